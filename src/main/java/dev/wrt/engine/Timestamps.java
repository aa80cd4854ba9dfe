package dev.wrt.engine;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Comparator;
import java.util.Optional;

/**
 * Lenient parsing of the timestamps reported by the metrics store.
 * Accepts ISO date-times with a 'T' or a single space between date and time,
 * optionally followed by {@code Z}, {@code +HH:MM} or {@code +HHMM}.
 * Local date-times are read as UTC.
 */
public final class Timestamps {

    private static final int SEPARATOR_INDEX = 10;

    private static final DateTimeFormatter T_SEPARATED = formatter('T');
    private static final DateTimeFormatter SPACE_SEPARATED = formatter(' ');

    /** Parsed instants ascending, unparsable values after all of them. */
    public static final Comparator<Optional<Instant>> UNPARSABLE_LAST =
        Comparator.comparing((Optional<Instant> o) -> o.orElse(null), Comparator.nullsLast(Comparator.<Instant>naturalOrder()));

    private Timestamps() {}

    public static Optional<Instant> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        if (trimmed.length() <= SEPARATOR_INDEX) {
            return Optional.empty();
        }
        DateTimeFormatter format = trimmed.charAt(SEPARATOR_INDEX) == ' ' ? SPACE_SEPARATED : T_SEPARATED;
        try {
            TemporalAccessor parsed = format.parseBest(trimmed, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offset) {
                return Optional.of(offset.toInstant());
            }
            return Optional.of(((LocalDateTime) parsed).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static DateTimeFormatter formatter(char separator) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral(separator)
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffset("+HH:MM:ss", "Z").optionalEnd()
            .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
            .toFormatter();
    }
}
