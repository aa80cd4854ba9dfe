package dev.wrt.engine;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class TimestampsTest {

    @Test
    void parsesLocalTimesAsUtc() {
        assertThat(Timestamps.parse("2024-01-01T00:00:00")).contains(Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(Timestamps.parse("2024-01-01 01:30:00")).contains(Instant.parse("2024-01-01T01:30:00Z"));
        assertThat(Timestamps.parse("2024-01-01T00:00:00.250")).contains(Instant.parse("2024-01-01T00:00:00.250Z"));
    }

    @Test
    void honoursOffsets() {
        assertThat(Timestamps.parse("2024-01-01T00:00:00Z")).contains(Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(Timestamps.parse("2024-01-01T02:00:00+02:00")).contains(Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    void acceptsCompactOffsets() {
        assertThat(Timestamps.parse("2024-01-01T00:00:00.000+0000")).contains(Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(Timestamps.parse("2024-01-01T02:00:00+0200")).contains(Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(Timestamps.parse("2024-01-01 02:00:00-0130")).contains(Instant.parse("2024-01-01T03:30:00Z"));
    }

    @Test
    void requiresExactlyOneSeparatorBetweenDateAndTime() {
        assertThat(Timestamps.parse("2024-01-01T 00:00")).isEmpty();
        assertThat(Timestamps.parse("2024-01-01  00:00:00")).isEmpty();
        assertThat(Timestamps.parse("2024-01-0100:00:00")).isEmpty();
        assertThat(Timestamps.parse("2024-01-01")).isEmpty();
    }

    @Test
    void unparsableValuesAreEmpty() {
        assertThat(Timestamps.parse(null)).isEmpty();
        assertThat(Timestamps.parse("")).isEmpty();
        assertThat(Timestamps.parse("yesterday")).isEmpty();
        assertThat(Timestamps.parse("2024-13-01T00:00:00")).isEmpty();
    }

    @Test
    void comparatorPutsUnparsableLast() {
        var values = new ArrayList<>(List.of(
            Optional.<Instant>empty(),
            Optional.of(Instant.parse("2024-01-02T00:00:00Z")),
            Optional.of(Instant.parse("2024-01-01T00:00:00Z"))
        ));

        values.sort(Timestamps.UNPARSABLE_LAST);

        assertThat(values).containsExactly(
            Optional.of(Instant.parse("2024-01-01T00:00:00Z")),
            Optional.of(Instant.parse("2024-01-02T00:00:00Z")),
            Optional.empty()
        );
    }
}
