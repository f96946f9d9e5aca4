package czm.carwash_be.capacity;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Booking lifecycle states as written by the booking subsystem.
 *
 * <p>Only pending, confirmed and in-progress bookings hold their resource; terminal states release it.</p>
 */
public enum BookingStatus {
    PENDING("pending", true),
    CONFIRMED("confirmed", true),
    IN_PROGRESS("in_progress", true),
    COMPLETED("completed", false),
    CANCELLED("cancelled", false),
    NO_SHOW("no_show", false);

    private final String code;
    private final boolean occupiesResource;

    BookingStatus(String code, boolean occupiesResource) {
        this.code = code;
        this.occupiesResource = occupiesResource;
    }

    public String code() {
        return code;
    }

    public boolean occupiesResource() {
        return occupiesResource;
    }

    public static List<BookingStatus> occupying() {
        return Arrays.stream(values()).filter(BookingStatus::occupiesResource).toList();
    }

    public static Optional<BookingStatus> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(status -> status.code.equals(normalized))
                .findFirst();
    }
}
