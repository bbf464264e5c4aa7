package dao.tron.txverify.model;

import java.time.Instant;

/**
 * Half-open UTC interval {@code [start, end)}. Either bound may be null (open).
 */
public record TimeRange(Instant start, Instant end) {

    public TimeRange {
        if (start != null && end != null && !start.isBefore(end)) {
            throw new IllegalArgumentException("Time range start must be before end: " + start + " >= " + end);
        }
    }

    public static TimeRange between(Instant start, Instant end) {
        return new TimeRange(start, end);
    }

    public boolean contains(Instant instant) {
        if (instant == null) return false;
        if (start != null && instant.isBefore(start)) return false;
        return end == null || instant.isBefore(end);
    }

    public boolean isUnbounded() {
        return start == null && end == null;
    }
}
