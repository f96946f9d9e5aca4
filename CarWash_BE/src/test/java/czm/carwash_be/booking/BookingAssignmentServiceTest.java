package czm.carwash_be.booking;

import czm.carwash_be.capacity.AvailabilityService;
import czm.carwash_be.capacity.BookingStatus;
import czm.carwash_be.facility.ResourceCatalog;
import czm.carwash_be.facility.ResourceStatus;
import czm.carwash_be.facility.VehicleSize;
import czm.carwash_be.facility.WashBay;
import czm.carwash_be.web.ApiException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BookingAssignmentServiceTest {
    private static final OffsetDateTime NINE = OffsetDateTime.parse("2024-01-01T09:00:00Z");

    @Mock
    private BookingDao bookingDao;

    @Mock
    private ResourceCatalog catalog;

    @Mock
    private AvailabilityService availabilityService;

    @InjectMocks
    private BookingAssignmentService service;

    private final WashBay b1 = bay("B1", VehicleSize.LARGE);
    private final WashBay b2 = bay("B2", VehicleSize.OVERSIZED);

    @Test
    void assignsFirstFreeBayUnderLock() {
        BookingDao.BookingRow booking = booking(BookingStatus.CONFIRMED, "large");
        when(bookingDao.findById(booking.id())).thenReturn(Optional.of(booking));
        when(catalog.listCompatibleBays(VehicleSize.LARGE)).thenReturn(List.of(b1, b2));
        when(availabilityService.checkResourceAvailability(b1.id(), NINE, 45, booking.id())).thenReturn(true);

        WashBayAssignmentResponse response = service.assignWashBay(booking.id(), null);

        assertEquals(b1.id(), response.bayId());
        assertEquals("B1", response.bayNumber());
        assertEquals("large", response.vehicleSize());
        InOrder order = inOrder(availabilityService, bookingDao);
        order.verify(availabilityService).checkResourceAvailability(b1.id(), NINE, 45, booking.id());
        order.verify(bookingDao).lockResource(b1.id());
        order.verify(availabilityService).checkResourceAvailability(b1.id(), NINE, 45, booking.id());
        order.verify(bookingDao).assignResource(booking.id(), b1.id());
    }

    @Test
    void movesOnWhenBayIsTakenWhileWaitingForLock() {
        BookingDao.BookingRow booking = booking(BookingStatus.PENDING, "large");
        when(bookingDao.findById(booking.id())).thenReturn(Optional.of(booking));
        when(catalog.listCompatibleBays(VehicleSize.LARGE)).thenReturn(List.of(b1, b2));
        when(availabilityService.checkResourceAvailability(b1.id(), NINE, 45, booking.id())).thenReturn(true, false);
        when(availabilityService.checkResourceAvailability(b2.id(), NINE, 45, booking.id())).thenReturn(true);

        WashBayAssignmentResponse response = service.assignWashBay(booking.id(), null);

        assertEquals(b2.id(), response.bayId());
        verify(bookingDao, never()).assignResource(booking.id(), b1.id());
        verify(bookingDao).lockResource(b1.id());
        verify(bookingDao).lockResource(b2.id());
    }

    @Test
    void requestedSizeOverridesStoredSize() {
        BookingDao.BookingRow booking = booking(BookingStatus.CONFIRMED, "compact");
        when(bookingDao.findById(booking.id())).thenReturn(Optional.of(booking));
        when(catalog.listCompatibleBays(VehicleSize.OVERSIZED)).thenReturn(List.of(b2));
        when(availabilityService.checkResourceAvailability(b2.id(), NINE, 45, booking.id())).thenReturn(true);

        WashBayAssignmentResponse response = service.assignWashBay(booking.id(), "oversized");

        assertEquals(b2.id(), response.bayId());
        assertEquals("oversized", response.vehicleSize());
    }

    @Test
    void noCapacityWhenAllCompatibleBaysAreBusy() {
        BookingDao.BookingRow booking = booking(BookingStatus.CONFIRMED, "large");
        when(bookingDao.findById(booking.id())).thenReturn(Optional.of(booking));
        when(catalog.listCompatibleBays(VehicleSize.LARGE)).thenReturn(List.of(b1, b2));

        ApiException ex = assertThrows(ApiException.class, () -> service.assignWashBay(booking.id(), null));

        assertEquals("NO_CAPACITY", ex.getCode());
        assertEquals(HttpStatus.CONFLICT, ex.getStatus());
        verify(bookingDao, never()).lockResource(any());
        verify(bookingDao, never()).assignResource(any(), any());
    }

    @Test
    void terminalBookingCannotBeAssigned() {
        BookingDao.BookingRow booking = booking(BookingStatus.CANCELLED, "large");
        when(bookingDao.findById(booking.id())).thenReturn(Optional.of(booking));

        ApiException ex = assertThrows(ApiException.class, () -> service.assignWashBay(booking.id(), null));

        assertEquals("CONFLICT", ex.getCode());
        assertEquals("booking_status_terminal", ex.getDetails());
        verifyNoInteractions(catalog, availabilityService);
    }

    @Test
    void missingBookingIsNotFound() {
        UUID id = UUID.randomUUID();
        when(bookingDao.findById(id)).thenReturn(Optional.empty());

        ApiException ex = assertThrows(ApiException.class, () -> service.assignWashBay(id, "large"));
        assertEquals("NOT_FOUND", ex.getCode());
    }

    @Test
    void unknownVehicleSizeIsRejected() {
        BookingDao.BookingRow booking = booking(BookingStatus.PENDING, "large");
        when(bookingDao.findById(booking.id())).thenReturn(Optional.of(booking));

        ApiException ex = assertThrows(ApiException.class, () -> service.assignWashBay(booking.id(), "truck"));
        assertEquals("VALIDATION", ex.getCode());
        verifyNoInteractions(catalog);
    }

    @Test
    void advisoryLockKeyIsStablePerResource() {
        UUID id = UUID.fromString("3f2504e0-4f89-11d3-9a0c-0305e82c3301");
        assertEquals(BookingDao.advisoryLockKey(id), BookingDao.advisoryLockKey(UUID.fromString(id.toString())));
        assertEquals(id.getMostSignificantBits() ^ id.getLeastSignificantBits(), BookingDao.advisoryLockKey(id));
    }

    private static WashBay bay(String number, VehicleSize size) {
        return new WashBay(UUID.randomUUID(), number, size, List.of(), ResourceStatus.ACTIVE, null, NINE, NINE, null);
    }

    private static BookingDao.BookingRow booking(BookingStatus status, String vehicleSize) {
        return new BookingDao.BookingRow(UUID.randomUUID(), null, vehicleSize, NINE, 45, status);
    }
}
