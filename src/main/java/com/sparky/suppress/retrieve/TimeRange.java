package com.sparky.suppress.retrieve;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/**
 * Inclusive from / to bounds for a retrieve, already composed with the configured timezone.
 * Input is minute resolution local time ({@code 2023-01-31T14:05}); output carries seconds and
 * the numeric UTC offset that applies on that date ({@code 2023-01-31T14:05:00-0500}).
 */
public class TimeRange {
    private static final DateTimeFormatter INPUT_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm")
        .withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter OUTPUT_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ssZ");

    private final String from;
    private final String to;

    private TimeRange(String from, String to) {
        this.from = from;
        this.to = to;
    }

    /**
     * @throws IllegalArgumentException when either bound is not in the expected format
     */
    public static TimeRange of(String fromTime, String toTime, ZoneId zone) {
        return new TimeRange(compose(fromTime, zone, "from_time"), compose(toTime, zone, "to_time"));
    }

    public static boolean isExpectedFormat(String timestamp) {
        if (timestamp == null) {
            return false;
        }
        try {
            LocalDateTime.parse(timestamp, INPUT_FORMAT);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    static String compose(String timestamp, ZoneId zone, String name) {
        if (!isExpectedFormat(timestamp)) {
            throw new IllegalArgumentException("unrecognised " + name + ": " + timestamp);
        }
        // a repeated wall-clock hour resolves to the standard time offset
        ZonedDateTime local = LocalDateTime.parse(timestamp, INPUT_FORMAT).atZone(zone).withLaterOffsetAtOverlap();
        return local.format(OUTPUT_FORMAT);
    }

    public String from() {
        return from;
    }

    public String to() {
        return to;
    }

    @Override
    public String toString() {
        return from + " to " + to;
    }
}
