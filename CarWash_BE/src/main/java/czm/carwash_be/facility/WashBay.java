package czm.carwash_be.facility;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable projection of the {@code wash_bay} table.
 */
public record WashBay(
        UUID id,
        String bayNumber,
        VehicleSize maxVehicleSize,
        List<String> equipmentTypes,
        ResourceStatus status,
        GeoLocation location,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        OffsetDateTime deletedAt) implements SchedulableResource {

    public WashBay {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(bayNumber, "bayNumber");
        Objects.requireNonNull(maxVehicleSize, "maxVehicleSize");
        Objects.requireNonNull(status, "status");
        equipmentTypes = equipmentTypes == null ? List.of() : List.copyOf(equipmentTypes);
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.WASH_BAY;
    }

    @Override
    public String label() {
        return bayNumber;
    }

    public boolean canAccommodate(VehicleSize vehicleSize) {
        return maxVehicleSize.accommodates(vehicleSize);
    }
}
