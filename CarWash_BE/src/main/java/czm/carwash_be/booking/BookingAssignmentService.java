package czm.carwash_be.booking;

import czm.carwash_be.capacity.AvailabilityService;
import czm.carwash_be.facility.FacilityInput;
import czm.carwash_be.facility.ResourceCatalog;
import czm.carwash_be.facility.VehicleSize;
import czm.carwash_be.facility.WashBay;
import czm.carwash_be.web.ApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Assigns a wash bay to an existing booking.
 *
 * <p>Availability reads are not atomic with the write, so every candidate is re-checked while holding the
 * per-bay advisory lock. Two concurrent assignments for the same bay serialise on that lock and the second
 * one sees the first one's booking.</p>
 */
@Service
public class BookingAssignmentService {
    private static final Logger log = LoggerFactory.getLogger(BookingAssignmentService.class);

    private final BookingDao bookingDao;
    private final ResourceCatalog catalog;
    private final AvailabilityService availabilityService;

    public BookingAssignmentService(BookingDao bookingDao, ResourceCatalog catalog, AvailabilityService availabilityService) {
        this.bookingDao = bookingDao;
        this.catalog = catalog;
        this.availabilityService = availabilityService;
    }

    @Transactional
    public WashBayAssignmentResponse assignWashBay(UUID bookingId, String vehicleSizeCode) {
        BookingDao.BookingRow booking = bookingDao.findById(bookingId)
                .orElseThrow(() -> ApiException.notFound("Rezervace nebyla nalezena.", "booking"));
        if (!booking.status().occupiesResource()) {
            throw ApiException.conflict("Rezervace ve stavu '" + booking.status().code() + "' už nelze přiřadit k boxu.",
                    "booking_status_terminal");
        }
        VehicleSize vehicleSize = FacilityInput.requireVehicleSize(
                vehicleSizeCode != null && !vehicleSizeCode.isBlank() ? vehicleSizeCode : booking.vehicleSize());

        List<WashBay> candidates = catalog.listCompatibleBays(vehicleSize);
        for (WashBay bay : candidates) {
            if (!isFree(bay, booking)) {
                continue;
            }
            bookingDao.lockResource(bay.id());
            // Mezi první kontrolou a zámkem mohl box obsadit jiný požadavek.
            if (!isFree(bay, booking)) {
                log.debug("Bay {} taken while waiting for lock, booking {}", bay.bayNumber(), bookingId);
                continue;
            }
            bookingDao.assignResource(bookingId, bay.id());
            log.info("Booking {} assigned to wash bay {} ({})", bookingId, bay.bayNumber(), bay.id());
            return new WashBayAssignmentResponse(bookingId, bay.id(), bay.bayNumber(), vehicleSize.code(),
                    booking.scheduledAt(), booking.durationMinutes());
        }

        log.info("No wash bay free for booking {} ({}, {} from {})",
                bookingId, vehicleSize.code(), booking.durationMinutes(), booking.scheduledAt());
        throw ApiException.noCapacity("Pro zvolený termín není volný žádný vhodný mycí box.",
                "compatible_bays=" + candidates.size());
    }

    private boolean isFree(WashBay bay, BookingDao.BookingRow booking) {
        return availabilityService.checkResourceAvailability(
                bay.id(), booking.scheduledAt(), booking.durationMinutes(), booking.id());
    }
}
