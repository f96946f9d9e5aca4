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

import java.util.UUID;

@RestController
@RequestMapping("/api/facilities/wash-bays")
@Tag(name = "Wash bays", description = "Konfigurace mycích boxů")
public class WashBayController {
    private final WashBayService service;

    public WashBayController(WashBayService service) {
        this.service = service;
    }

    @PostMapping
    @Operation(summary = "Nový mycí box", description = "Vytvoří mycí box s maximální velikostí vozidla a vybavením.")
    @ApiResponse(responseCode = "201", description = "Mycí box byl vytvořen.")
    public ResponseEntity<WashBayResponse> create(@RequestBody WashBayRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(service.create(request));
    }

    @GetMapping
    @Operation(summary = "Seznam mycích boxů", description = "Vrací boxy seřazené podle čísla včetně počtů podle stavu.")
    public WashBayListResponse list(@Parameter(description = "Filtr stavu (active, inactive, maintenance)")
                                    @RequestParam(value = "status", required = false) String status,
                                    @Parameter(description = "Zahrnout i smazané boxy")
                                    @RequestParam(value = "include_deleted", required = false, defaultValue = "false") boolean includeDeleted) {
        return service.list(status, includeDeleted);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Detail mycího boxu")
    public WashBayResponse get(@PathVariable UUID id) {
        return service.get(id);
    }

    @PatchMapping("/{id}")
    @Operation(summary = "Úprava mycího boxu", description = "Aktualizuje pouze zaslaná pole, ostatní zůstávají beze změny.")
    public WashBayResponse update(@PathVariable UUID id, @RequestBody WashBayRequest request) {
        return service.update(id, request);
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Smazání mycího boxu", description = "Box je deaktivován a vyřazen z plánování kapacit.")
    public WashBayService.WashBayDeletedResponse delete(@PathVariable UUID id) {
        return service.delete(id);
    }
}
