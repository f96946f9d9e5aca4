package czm.carwash_be.facility;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record MobileTeamListResponse(
        @JsonProperty("mobile_teams") List<MobileTeamResponse> mobileTeams,
        @JsonProperty("total_count") int totalCount,
        @JsonProperty("active_count") long activeCount,
        @JsonProperty("inactive_count") long inactiveCount) {
}
