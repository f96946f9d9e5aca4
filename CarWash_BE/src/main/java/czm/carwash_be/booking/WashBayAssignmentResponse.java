package czm.carwash_be.booking;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.UUID;

public record WashBayAssignmentResponse(
        @JsonProperty("booking_id") UUID bookingId,
        @JsonProperty("bay_id") UUID bayId,
        @JsonProperty("bay_number") String bayNumber,
        @JsonProperty("vehicle_size") String vehicleSize,
        @JsonProperty("scheduled_at") OffsetDateTime scheduledAt,
        @JsonProperty("duration_minutes") int durationMinutes) {
}
