package czm.carwash_be.facility;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * DTO used for create/update wash bay requests. On update every {@code null} field keeps its current value.
 */
public record WashBayRequest(
        @JsonProperty("bay_number") String bayNumber,
        @JsonProperty("max_vehicle_size") String maxVehicleSize,
        @JsonProperty("equipment_types") List<String> equipmentTypes,
        @JsonProperty("status") String status,
        @JsonProperty("latitude") BigDecimal latitude,
        @JsonProperty("longitude") BigDecimal longitude) {
}
