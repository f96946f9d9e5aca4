package czm.carwash_be.facility;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record WashBayResponse(
        @JsonProperty("id") UUID id,
        @JsonProperty("bay_number") String bayNumber,
        @JsonProperty("max_vehicle_size") String maxVehicleSize,
        @JsonProperty("equipment_types") List<String> equipmentTypes,
        @JsonProperty("status") String status,
        @JsonProperty("location") LocationResponse location,
        @JsonProperty("created_at") OffsetDateTime createdAt,
        @JsonProperty("updated_at") OffsetDateTime updatedAt,
        @JsonProperty("deleted_at") OffsetDateTime deletedAt) {

    static WashBayResponse of(WashBay bay) {
        return new WashBayResponse(
                bay.id(),
                bay.bayNumber(),
                bay.maxVehicleSize().code(),
                bay.equipmentTypes(),
                bay.status().code(),
                LocationResponse.of(bay.location()),
                bay.createdAt(),
                bay.updatedAt(),
                bay.deletedAt());
    }
}
