package czm.carwash_be.booking;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Optional body of the assignment call; without {@code vehicle_size} the size stored on the booking is used.
 */
public record WashBayAssignmentRequest(@JsonProperty("vehicle_size") String vehicleSize) {
}
