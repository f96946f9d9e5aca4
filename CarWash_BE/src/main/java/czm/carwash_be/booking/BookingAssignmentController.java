package czm.carwash_be.booking;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/bookings")
@Tag(name = "Booking assignment", description = "Přiřazení rezervací k mycím boxům")
public class BookingAssignmentController {
    private final BookingAssignmentService service;

    public BookingAssignmentController(BookingAssignmentService service) {
        this.service = service;
    }

    @PostMapping("/{id}/wash-bay-assignment")
    @Operation(summary = "Přiřadit mycí box",
            description = "Najde první volný kompatibilní box a zapíše ho do rezervace. Bez těla se použije velikost vozidla z rezervace.")
    @ApiResponse(responseCode = "200", description = "Box byl přiřazen.")
    @ApiResponse(responseCode = "409", description = "Žádný vhodný box není volný, nebo je rezervace v koncovém stavu.")
    public WashBayAssignmentResponse assign(@PathVariable UUID id,
                                            @RequestBody(required = false) WashBayAssignmentRequest request) {
        return service.assignWashBay(id, request != null ? request.vehicleSize() : null);
    }
}
