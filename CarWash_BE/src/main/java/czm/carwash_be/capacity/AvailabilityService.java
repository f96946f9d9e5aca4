package czm.carwash_be.capacity;

import czm.carwash_be.config.CapacityProperties;
import czm.carwash_be.facility.GeoLocation;
import czm.carwash_be.facility.MobileTeam;
import czm.carwash_be.facility.ResourceCatalog;
import czm.carwash_be.facility.SchedulableResource;
import czm.carwash_be.facility.VehicleSize;
import czm.carwash_be.facility.WashBay;
import czm.carwash_be.web.ApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves which wash bays or mobile teams are free for a requested time window.
 *
 * <p>Every call is a fresh read of the catalog and of the bookings; nothing is cached. The sequence
 * "find a free resource, then write the booking" is therefore not atomic here: the caller has to hold a
 * per-resource lock (see {@code BookingAssignmentService}) or rely on a database constraint between the
 * check and the write.</p>
 */
@Service
public class AvailabilityService {
    private static final Logger log = LoggerFactory.getLogger(AvailabilityService.class);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final ResourceCatalog catalog;
    private final OccupancyDao occupancyDao;
    private final CapacityProperties properties;

    public AvailabilityService(ResourceCatalog catalog, OccupancyDao occupancyDao, CapacityProperties properties) {
        this.catalog = catalog;
        this.occupancyDao = occupancyDao;
        this.properties = properties;
    }

    /**
     * Returns {@code true} when no booking holding the resource overlaps {@code [scheduledAt, scheduledAt + duration)}.
     *
     * @param excludeBookingId booking ignored by the check, used when an existing booking is moved
     * @throws ApiException NOT_FOUND when the resource does not exist or was deleted
     */
    public boolean checkResourceAvailability(UUID resourceId,
                                             OffsetDateTime scheduledAt,
                                             int durationMinutes,
                                             UUID excludeBookingId) {
        Objects.requireNonNull(resourceId, "resourceId");
        TimeInterval requested = requestedInterval(scheduledAt, durationMinutes);
        SchedulableResource resource = catalog.findResource(resourceId)
                .orElseThrow(() -> ApiException.notFound("Zdroj pro kontrolu dostupnosti nebyl nalezen.", "resource"));
        if (!resource.isBookable()) {
            log.debug("{} {} is {}, answering from its bookings only", resource.kind(), resource.label(), resource.status().code());
        }
        return isFree(resourceId, requested, excludeBookingId);
    }

    public boolean checkResourceAvailability(UUID resourceId, OffsetDateTime scheduledAt, int durationMinutes) {
        return checkResourceAvailability(resourceId, scheduledAt, durationMinutes, null);
    }

    /**
     * First-fit: the lowest-numbered compatible bay that is free, or empty when all are taken.
     */
    public Optional<UUID> findAvailableResource(OffsetDateTime scheduledAt, int durationMinutes, VehicleSize vehicleSize) {
        Objects.requireNonNull(vehicleSize, "vehicleSize");
        TimeInterval requested = requestedInterval(scheduledAt, durationMinutes);
        for (WashBay bay : catalog.listCompatibleBays(vehicleSize)) {
            if (isFree(bay.id(), requested, null)) {
                return Optional.of(bay.id());
            }
        }
        log.debug("No {} bay free for {}", vehicleSize.code(), requested);
        return Optional.empty();
    }

    /**
     * First-fit over the teams covering {@code customerLocation}, smallest service area first.
     */
    public Optional<UUID> findAvailableMobileTeam(GeoLocation customerLocation, OffsetDateTime scheduledAt, int durationMinutes) {
        Objects.requireNonNull(customerLocation, "customerLocation");
        TimeInterval requested = requestedInterval(scheduledAt, durationMinutes);
        for (MobileTeam team : catalog.listTeamsWithinRadius(customerLocation)) {
            if (isFree(team.id(), requested, null)) {
                return Optional.of(team.id());
            }
        }
        return Optional.empty();
    }

    /**
     * Number of active bays free for the window, regardless of the vehicle size they accept.
     */
    public int getAvailableCapacity(OffsetDateTime scheduledAt, int durationMinutes) {
        TimeInterval requested = requestedInterval(scheduledAt, durationMinutes);
        return countFree(catalog.listActiveBays(), requested);
    }

    public CapacitySnapshot getTimeSlotCapacityInfo(OffsetDateTime scheduledAt, int durationMinutes) {
        TimeInterval requested = requestedInterval(scheduledAt, durationMinutes);
        List<WashBay> bays = catalog.listActiveBays();

        int available = 0;
        List<CapacitySnapshot.BayAvailability> details = new ArrayList<>(bays.size());
        for (WashBay bay : bays) {
            boolean free = isFree(bay.id(), requested, null);
            if (free) {
                available++;
            }
            details.add(new CapacitySnapshot.BayAvailability(bay.id(), bay.bayNumber(), bay.maxVehicleSize().code(), free));
        }
        int total = bays.size();
        int booked = total - available;
        return new CapacitySnapshot(scheduledAt, durationMinutes, total, available, booked,
                utilizationPercent(booked, total), List.copyOf(details));
    }

    /**
     * Steps from {@code startDate} to {@code endDate} inclusive and returns only the steps with at least one free bay.
     *
     * <p>Steps without capacity are left out rather than reported with zero capacity.</p>
     *
     * @param slotIntervalMinutes step between slot starts; {@code null} uses the configured default
     */
    public List<TimeSlot> enumerateAvailableTimeSlots(OffsetDateTime startDate,
                                                      OffsetDateTime endDate,
                                                      int durationMinutes,
                                                      Integer slotIntervalMinutes) {
        if (startDate == null || endDate == null) {
            throw ApiException.validation("Začátek i konec období jsou povinné.", "interval_required");
        }
        if (endDate.isBefore(startDate)) {
            throw ApiException.validation("Konec období nesmí být dříve než začátek.", "interval_invalid");
        }
        validateDuration(durationMinutes);
        int step = slotIntervalMinutes != null ? slotIntervalMinutes : properties.getDefaultSlotIntervalMinutes();
        if (step <= 0) {
            throw ApiException.validation("Interval mezi sloty musí být kladný.", "slot_interval_invalid");
        }
        long steps = Duration.between(startDate, endDate).toMinutes() / step + 1;
        if (steps > properties.getMaxSlotSteps()) {
            throw ApiException.validation("Období obsahuje příliš mnoho slotů (" + steps + "), zkraťte ho nebo zvětšete interval.",
                    "slot_range_too_large");
        }

        // Jedno načtení boxů pro celý výčet, obsazenost se čte pro každý krok zvlášť.
        List<WashBay> bays = catalog.listActiveBays();
        List<TimeSlot> slots = new ArrayList<>();
        OffsetDateTime current = startDate;
        while (!current.isAfter(endDate)) {
            TimeInterval candidate = TimeInterval.ofMinutes(current, durationMinutes);
            int capacity = countFree(bays, candidate);
            if (capacity > 0) {
                slots.add(new TimeSlot(candidate.start(), candidate.end(), capacity, durationMinutes));
            }
            current = current.plusMinutes(step);
        }
        return slots;
    }

    /**
     * {@code round(booked / total * 100, 2)} with HALF_UP rounding; zero when there are no bays.
     */
    static double utilizationPercent(int booked, int total) {
        if (total <= 0) {
            return 0d;
        }
        return BigDecimal.valueOf(booked)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }

    private int countFree(List<WashBay> bays, TimeInterval requested) {
        int free = 0;
        for (WashBay bay : bays) {
            if (isFree(bay.id(), requested, null)) {
                free++;
            }
        }
        return free;
    }

    private boolean isFree(UUID resourceId, TimeInterval requested, UUID excludeBookingId) {
        Duration window = Duration.ofHours(properties.getSearchWindowHours());
        List<OccupancyDao.OccupancyRow> candidates = occupancyDao.listOccupying(
                resourceId,
                requested.start().minus(window),
                requested.end().plus(window),
                excludeBookingId);
        for (OccupancyDao.OccupancyRow booking : candidates) {
            if (excludeBookingId != null && excludeBookingId.equals(booking.bookingId())) {
                continue;
            }
            if (booking.interval().overlaps(requested)) {
                return false;
            }
        }
        return true;
    }

    private static TimeInterval requestedInterval(OffsetDateTime scheduledAt, int durationMinutes) {
        if (scheduledAt == null) {
            throw ApiException.validation("Čas začátku je povinný.", "scheduled_at_required");
        }
        validateDuration(durationMinutes);
        return TimeInterval.ofMinutes(scheduledAt, durationMinutes);
    }

    private static void validateDuration(int durationMinutes) {
        if (durationMinutes <= 0) {
            throw ApiException.validation("Délka služby musí být kladná.", "duration_invalid");
        }
    }
}
