package czm.carwash_be.capacity;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Bay utilisation for one time slot. {@code availableBays + bookedBays == totalBays} always holds.
 */
public record CapacitySnapshot(
        @JsonProperty("scheduled_at") OffsetDateTime scheduledAt,
        @JsonProperty("duration_minutes") int durationMinutes,
        @JsonProperty("total_bays") int totalBays,
        @JsonProperty("available_bays") int availableBays,
        @JsonProperty("booked_bays") int bookedBays,
        @JsonProperty("utilization_percent") double utilizationPercent,
        @JsonProperty("bay_details") List<BayAvailability> bayDetails) {

    public record BayAvailability(
            @JsonProperty("bay_id") UUID bayId,
            @JsonProperty("bay_number") String bayNumber,
            @JsonProperty("max_vehicle_size") String maxVehicleSize,
            @JsonProperty("is_available") boolean available) {}
}
