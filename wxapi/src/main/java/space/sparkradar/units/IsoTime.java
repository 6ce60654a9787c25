package space.sparkradar.units;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * ISO-8601 formatting used across the response: instants with millisecond
 * precision in UTC ({@code 2024-05-01T18:00:00.000Z}) and calendar dates
 * ({@code 2024-05-01}).
 */
public final class IsoTime {
    private static final DateTimeFormatter INSTANT = DateTimeFormatter
            .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'")
            .withZone(ZoneOffset.UTC);

    /**
     * Utility class; do not instantiate.
     */
    private IsoTime() {
    }

    public static String instant(Instant t) {
        return t == null ? null : INSTANT.format(t);
    }

    /**
     * Epoch seconds to an ISO instant; null stays null.
     */
    public static String epochSeconds(Long seconds) {
        return seconds == null ? null : instant(Instant.ofEpochSecond(seconds));
    }

    /**
     * Epoch seconds to an ISO instant, treating 0 as "not reported".
     */
    public static String epochSecondsNonZero(Long seconds) {
        return seconds == null || seconds == 0L ? null : epochSeconds(seconds);
    }

    /**
     * UTC calendar date of an epoch-seconds timestamp.
     */
    public static String utcDate(Long seconds) {
        if (seconds == null)
            return null;
        return LocalDate.ofInstant(Instant.ofEpochSecond(seconds), ZoneOffset.UTC).toString();
    }
}
