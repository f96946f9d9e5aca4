package czm.carwash_be.facility;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Vehicle size categories ordered from the smallest to the largest.
 *
 * <p>A bay rated for a size accommodates that size and every smaller one.</p>
 */
public enum VehicleSize {
    COMPACT("compact", 1),
    STANDARD("standard", 2),
    LARGE("large", 3),
    OVERSIZED("oversized", 4);

    private final String code;
    private final int rank;

    VehicleSize(String code, int rank) {
        this.code = code;
        this.rank = rank;
    }

    public String code() {
        return code;
    }

    public int rank() {
        return rank;
    }

    /**
     * Returns {@code true} when a resource rated for this size can take a vehicle of {@code vehicle} size.
     */
    public boolean accommodates(VehicleSize vehicle) {
        return vehicle.rank <= rank;
    }

    /**
     * All sizes whose rated resources accommodate {@code vehicle}, smallest first.
     */
    public static List<VehicleSize> ratingsAccommodating(VehicleSize vehicle) {
        return Arrays.stream(values())
                .filter(rating -> rating.accommodates(vehicle))
                .toList();
    }

    public static Optional<VehicleSize> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(size -> size.code.equals(normalized))
                .findFirst();
    }
}
