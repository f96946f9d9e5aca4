package czm.carwash_be.facility;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Lifecycle state of a schedulable resource as stored in the {@code status} column.
 */
public enum ResourceStatus {
    ACTIVE("active"),
    INACTIVE("inactive"),
    MAINTENANCE("maintenance");

    private final String code;

    ResourceStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<ResourceStatus> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(status -> status.code.equals(normalized))
                .findFirst();
    }
}
