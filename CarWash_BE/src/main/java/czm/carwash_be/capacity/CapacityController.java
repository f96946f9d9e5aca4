package czm.carwash_be.capacity;

import com.fasterxml.jackson.annotation.JsonProperty;
import czm.carwash_be.facility.FacilityInput;
import czm.carwash_be.facility.GeoLocation;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@RestController
@RequestMapping("/api/capacity")
@Tag(name = "Capacity", description = "Dostupnost mycích boxů a mobilních týmů")
public class CapacityController {
    private final AvailabilityService availabilityService;

    public CapacityController(AvailabilityService availabilityService) {
        this.availabilityService = availabilityService;
    }

    public record ResourceAvailabilityResponse(
            @JsonProperty("resource_id") UUID resourceId,
            @JsonProperty("scheduled_at") OffsetDateTime scheduledAt,
            @JsonProperty("duration_minutes") int durationMinutes,
            @JsonProperty("available") boolean available) {}

    public record ResourceMatchResponse(
            @JsonProperty("resource_id") UUID resourceId,
            @JsonProperty("found") boolean found) {

        static ResourceMatchResponse of(Optional<UUID> resourceId) {
            return new ResourceMatchResponse(resourceId.orElse(null), resourceId.isPresent());
        }
    }

    public record AvailableCountResponse(
            @JsonProperty("scheduled_at") OffsetDateTime scheduledAt,
            @JsonProperty("duration_minutes") int durationMinutes,
            @JsonProperty("available_capacity") int availableCapacity) {}

    @GetMapping("/resources/{id}/availability")
    @Operation(summary = "Dostupnost konkrétního zdroje",
            description = "Ověří, zda box nebo mobilní tým nemá v požadovaném čase překrývající se rezervaci.")
    public ResourceAvailabilityResponse resourceAvailability(
            @PathVariable UUID id,
            @Parameter(description = "Začátek služby (ISO-8601)", required = true)
            @RequestParam("scheduled_at") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime scheduledAt,
            @Parameter(description = "Délka služby v minutách", required = true)
            @RequestParam("duration_minutes") int durationMinutes,
            @Parameter(description = "Rezervace, která se při kontrole ignoruje (přesun termínu)")
            @RequestParam(value = "exclude_booking_id", required = false) UUID excludeBookingId) {
        boolean available = availabilityService.checkResourceAvailability(id, scheduledAt, durationMinutes, excludeBookingId);
        return new ResourceAvailabilityResponse(id, scheduledAt, durationMinutes, available);
    }

    @GetMapping("/available-bay")
    @Operation(summary = "Volný box pro vozidlo",
            description = "Vrací první volný kompatibilní box podle čísla boxu; found=false, pokud žádný volný není.")
    public ResourceMatchResponse availableBay(
            @RequestParam("scheduled_at") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime scheduledAt,
            @RequestParam("duration_minutes") int durationMinutes,
            @Parameter(description = "Velikost vozidla (compact, standard, large, oversized)", required = true)
            @RequestParam("vehicle_size") String vehicleSize) {
        return ResourceMatchResponse.of(availabilityService.findAvailableResource(
                scheduledAt, durationMinutes, FacilityInput.requireVehicleSize(vehicleSize)));
    }

    @GetMapping("/available-count")
    @Operation(summary = "Počet volných boxů")
    public AvailableCountResponse availableCount(
            @RequestParam("scheduled_at") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime scheduledAt,
            @RequestParam("duration_minutes") int durationMinutes) {
        return new AvailableCountResponse(scheduledAt, durationMinutes,
                availabilityService.getAvailableCapacity(scheduledAt, durationMinutes));
    }

    @GetMapping("/snapshot")
    @Operation(summary = "Vytížení boxů v čase", description = "Souhrn volných a obsazených boxů včetně detailu po boxech.")
    public CapacitySnapshot snapshot(
            @RequestParam("scheduled_at") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime scheduledAt,
            @RequestParam("duration_minutes") int durationMinutes) {
        return availabilityService.getTimeSlotCapacityInfo(scheduledAt, durationMinutes);
    }

    @GetMapping("/time-slots")
    @Operation(summary = "Volné časové sloty",
            description = "Projde období po zadaném kroku (včetně konce) a vrátí jen sloty s alespoň jedním volným boxem.")
    public List<TimeSlot> timeSlots(
            @RequestParam("start_date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime startDate,
            @RequestParam("end_date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime endDate,
            @RequestParam("duration_minutes") int durationMinutes,
            @Parameter(description = "Krok mezi sloty v minutách, výchozí 30")
            @RequestParam(value = "slot_interval_minutes", required = false) Integer slotIntervalMinutes) {
        return availabilityService.enumerateAvailableTimeSlots(startDate, endDate, durationMinutes, slotIntervalMinutes);
    }

    @GetMapping("/available-mobile-team")
    @Operation(summary = "Volný mobilní tým",
            description = "Vrací volný tým s nejmenším dosahem, který pokrývá polohu zákazníka.")
    public ResourceMatchResponse availableMobileTeam(
            @RequestParam("latitude") BigDecimal latitude,
            @RequestParam("longitude") BigDecimal longitude,
            @RequestParam("scheduled_at") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime scheduledAt,
            @RequestParam("duration_minutes") int durationMinutes) {
        GeoLocation location = FacilityInput.requireLocation(latitude, longitude);
        return ResourceMatchResponse.of(availabilityService.findAvailableMobileTeam(location, scheduledAt, durationMinutes));
    }
}
