package czm.carwash_be.capacity;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;

public record TimeSlot(
        @JsonProperty("start_time") OffsetDateTime startTime,
        @JsonProperty("end_time") OffsetDateTime endTime,
        @JsonProperty("available_capacity") int availableCapacity,
        @JsonProperty("duration_minutes") int durationMinutes) {
}
