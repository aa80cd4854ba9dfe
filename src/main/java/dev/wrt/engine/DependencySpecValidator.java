package dev.wrt.engine;

import dev.wrt.model.DependencySpec;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Advisory checks on a dependency spec. Nothing reported here stops a report:
 * undeclared steps sort last and cyclic dependencies only produce extra arrows.
 */
public final class DependencySpecValidator {

    private DependencySpecValidator() {}

    /**
     * Returns an empty list if the spec is consistent, otherwise one message per finding.
     */
    public static List<String> validate(DependencySpec spec) {
        var warnings = new ArrayList<String>();

        var seen = new HashSet<String>();
        for (String step : spec.runOrder()) {
            if (!seen.add(step)) {
                warnings.add("Step '%s' appears more than once in the run order; the first position is used"
                    .formatted(step));
            }
        }

        boolean checkDeclared = !spec.runOrder().isEmpty();
        for (var entry : spec.dependencies().entrySet()) {
            String upstream = entry.getKey();
            if (checkDeclared && !seen.contains(upstream)) {
                warnings.add("Dependency source '%s' is not in the run order".formatted(upstream));
            }
            for (String dependent : entry.getValue()) {
                if (upstream.equals(dependent)) {
                    warnings.add("Step '%s' depends on itself".formatted(upstream));
                } else if (checkDeclared && !seen.contains(dependent)) {
                    warnings.add("Step '%s': dependent '%s' is not in the run order"
                        .formatted(upstream, dependent));
                }
            }
        }

        return warnings;
    }
}
