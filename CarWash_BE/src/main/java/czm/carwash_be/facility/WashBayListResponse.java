package czm.carwash_be.facility;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Listing plus per-status counters of non-deleted bays for the facility dashboard.
 */
public record WashBayListResponse(
        @JsonProperty("wash_bays") List<WashBayResponse> washBays,
        @JsonProperty("total_count") int totalCount,
        @JsonProperty("active_count") long activeCount,
        @JsonProperty("inactive_count") long inactiveCount,
        @JsonProperty("maintenance_count") long maintenanceCount) {
}
