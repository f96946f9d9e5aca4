package czm.carwash_be.facility;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable projection of the {@code mobile_team} table.
 */
public record MobileTeam(
        UUID id,
        String teamName,
        GeoLocation baseLocation,
        BigDecimal serviceRadiusKm,
        int dailyCapacity,
        List<String> equipmentTypes,
        ResourceStatus status,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        OffsetDateTime deletedAt) implements SchedulableResource {

    public MobileTeam {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(teamName, "teamName");
        Objects.requireNonNull(baseLocation, "baseLocation");
        Objects.requireNonNull(serviceRadiusKm, "serviceRadiusKm");
        Objects.requireNonNull(status, "status");
        equipmentTypes = equipmentTypes == null ? List.of() : List.copyOf(equipmentTypes);
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.MOBILE_TEAM;
    }

    @Override
    public String label() {
        return teamName;
    }

    public double distanceKmTo(GeoLocation location) {
        return baseLocation.distanceKm(location);
    }

    /**
     * An inactive team never services a location, even one right next to its base.
     */
    public boolean canService(GeoLocation location) {
        if (status != ResourceStatus.ACTIVE || location == null) {
            return false;
        }
        return distanceKmTo(location) <= serviceRadiusKm.doubleValue();
    }
}
