package czm.carwash_be.capacity;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Half-open time interval {@code [start, end)}.
 */
public record TimeInterval(OffsetDateTime start, OffsetDateTime end) {

    public TimeInterval {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    public static TimeInterval ofMinutes(OffsetDateTime start, long durationMinutes) {
        return new TimeInterval(start, start.plusMinutes(durationMinutes));
    }

    /**
     * {@code start1 < end2 AND end1 > start2}; intervals that only touch do not overlap.
     */
    public boolean overlaps(TimeInterval other) {
        return start.isBefore(other.end) && end.isAfter(other.start);
    }
}
