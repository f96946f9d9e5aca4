package czm.carwash_be.facility;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/facilities/mobile-teams")
@Tag(name = "Mobile teams", description = "Správa mobilních mycích týmů")
public class MobileTeamController {
    private final MobileTeamService service;

    public MobileTeamController(MobileTeamService service) {
        this.service = service;
    }

    @PostMapping
    @Operation(summary = "Nový mobilní tým", description = "Vytvoří tým se základnou, dosahem služby a denní kapacitou.")
    @ApiResponse(responseCode = "201", description = "Tým byl vytvořen.")
    public ResponseEntity<MobileTeamResponse> create(@RequestBody MobileTeamRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(service.create(request));
    }

    @GetMapping
    @Operation(summary = "Seznam mobilních týmů")
    public MobileTeamListResponse list(@Parameter(description = "Filtr stavu (active, inactive)")
                                       @RequestParam(value = "status", required = false) String status,
                                       @RequestParam(value = "include_deleted", required = false, defaultValue = "false") boolean includeDeleted) {
        return service.list(status, includeDeleted);
    }

    @GetMapping("/within-radius")
    @Operation(summary = "Týmy v dosahu", description = "Vrací aktivní týmy, jejichž dosah pokrývá zadanou polohu zákazníka.")
    public List<MobileTeamService.TeamCoverageResponse> withinRadius(
            @Parameter(description = "Zeměpisná šířka zákazníka", required = true)
            @RequestParam("latitude") BigDecimal latitude,
            @Parameter(description = "Zeměpisná délka zákazníka", required = true)
            @RequestParam("longitude") BigDecimal longitude) {
        return service.listWithinRadius(latitude, longitude);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Detail mobilního týmu")
    public MobileTeamResponse get(@PathVariable UUID id) {
        return service.get(id);
    }

    @PatchMapping("/{id}")
    @Operation(summary = "Úprava mobilního týmu", description = "Aktualizuje pouze zaslaná pole.")
    public MobileTeamResponse update(@PathVariable UUID id, @RequestBody MobileTeamRequest request) {
        return service.update(id, request);
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Smazání mobilního týmu")
    public MobileTeamService.MobileTeamDeletedResponse delete(@PathVariable UUID id) {
        return service.delete(id);
    }
}
