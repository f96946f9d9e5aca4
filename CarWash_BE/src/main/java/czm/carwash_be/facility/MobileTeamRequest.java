package czm.carwash_be.facility;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * DTO used for create/update mobile team requests. On update every {@code null} field keeps its current value.
 */
public record MobileTeamRequest(
        @JsonProperty("team_name") String teamName,
        @JsonProperty("base_latitude") BigDecimal baseLatitude,
        @JsonProperty("base_longitude") BigDecimal baseLongitude,
        @JsonProperty("service_radius_km") BigDecimal serviceRadiusKm,
        @JsonProperty("daily_capacity") Integer dailyCapacity,
        @JsonProperty("equipment_types") List<String> equipmentTypes,
        @JsonProperty("status") String status) {
}
