package czm.carwash_be.facility;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record MobileTeamResponse(
        @JsonProperty("id") UUID id,
        @JsonProperty("team_name") String teamName,
        @JsonProperty("base_location") LocationResponse baseLocation,
        @JsonProperty("service_radius_km") BigDecimal serviceRadiusKm,
        @JsonProperty("daily_capacity") int dailyCapacity,
        @JsonProperty("equipment_types") List<String> equipmentTypes,
        @JsonProperty("status") String status,
        @JsonProperty("created_at") OffsetDateTime createdAt,
        @JsonProperty("updated_at") OffsetDateTime updatedAt,
        @JsonProperty("deleted_at") OffsetDateTime deletedAt) {

    static MobileTeamResponse of(MobileTeam team) {
        return new MobileTeamResponse(
                team.id(),
                team.teamName(),
                LocationResponse.of(team.baseLocation()),
                team.serviceRadiusKm(),
                team.dailyCapacity(),
                team.equipmentTypes(),
                team.status().code(),
                team.createdAt(),
                team.updatedAt(),
                team.deletedAt());
    }
}
