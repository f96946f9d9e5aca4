package czm.carwash_be.facility;

import com.fasterxml.jackson.annotation.JsonProperty;
import czm.carwash_be.web.ApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Application service for wash bay configuration: validation, uniqueness of bay numbers and soft delete.
 */
@Service
public class WashBayService {
    private static final Logger log = LoggerFactory.getLogger(WashBayService.class);
    private static final int MAX_BAY_NUMBER_LENGTH = 50;

    private final WashBayDao dao;

    public WashBayService(WashBayDao dao) {
        this.dao = dao;
    }

    @Transactional
    public WashBayResponse create(WashBayRequest request) {
        if (request == null) {
            throw ApiException.validation("Request nesmí být prázdný.", "request_required");
        }
        String bayNumber = FacilityInput.requireName(request.bayNumber(), MAX_BAY_NUMBER_LENGTH, "Číslo boxu", "bay_number");
        VehicleSize maxSize = FacilityInput.requireVehicleSize(request.maxVehicleSize());
        List<String> equipment = FacilityInput.normalizeEquipment(request.equipmentTypes());
        ResourceStatus status = FacilityInput.parseStatus(request.status());
        GeoLocation location = FacilityInput.optionalLocation(request.latitude(), request.longitude());
        ensureBayNumberUnique(bayNumber, null);

        WashBay inserted = dao.insert(bayNumber, maxSize, equipment, status != null ? status : ResourceStatus.ACTIVE, location);
        log.info("Wash bay created id={} number={} maxSize={}", inserted.id(), inserted.bayNumber(), inserted.maxVehicleSize().code());
        return WashBayResponse.of(inserted);
    }

    public WashBayResponse get(UUID id) {
        return WashBayResponse.of(requireBay(id));
    }

    public WashBayListResponse list(String statusCode, boolean includeDeleted) {
        ResourceStatus status = FacilityInput.parseStatus(statusCode);
        List<WashBayResponse> bays = dao.list(status, includeDeleted).stream()
                .map(WashBayResponse::of)
                .toList();
        Map<ResourceStatus, Long> counts = dao.countByStatus();
        return new WashBayListResponse(
                bays,
                bays.size(),
                counts.getOrDefault(ResourceStatus.ACTIVE, 0L),
                counts.getOrDefault(ResourceStatus.INACTIVE, 0L),
                counts.getOrDefault(ResourceStatus.MAINTENANCE, 0L));
    }

    @Transactional
    public WashBayResponse update(UUID id, WashBayRequest request) {
        if (request == null) {
            throw ApiException.validation("Request nesmí být prázdný.", "request_required");
        }
        WashBay existing = requireBay(id);

        String bayNumber = request.bayNumber() != null
                ? FacilityInput.requireName(request.bayNumber(), MAX_BAY_NUMBER_LENGTH, "Číslo boxu", "bay_number")
                : existing.bayNumber();
        VehicleSize maxSize = request.maxVehicleSize() != null
                ? FacilityInput.requireVehicleSize(request.maxVehicleSize())
                : existing.maxVehicleSize();
        List<String> equipment = request.equipmentTypes() != null
                ? FacilityInput.normalizeEquipment(request.equipmentTypes())
                : existing.equipmentTypes();
        ResourceStatus requestedStatus = FacilityInput.parseStatus(request.status());
        ResourceStatus status = requestedStatus != null ? requestedStatus : existing.status();
        GeoLocation location = request.latitude() != null || request.longitude() != null
                ? FacilityInput.requireLocation(request.latitude(), request.longitude())
                : existing.location();

        if (!bayNumber.equals(existing.bayNumber())) {
            ensureBayNumberUnique(bayNumber, existing.id());
        }

        WashBay updated = dao.update(existing.id(), bayNumber, maxSize, equipment, status, location)
                .orElseThrow(() -> ApiException.notFound("Mycí box nebyl nalezen.", "wash_bay"));
        if (existing.status() != updated.status()) {
            log.info("Wash bay {} status changed {} -> {}", updated.bayNumber(), existing.status().code(), updated.status().code());
        }
        log.info("Wash bay updated id={} number={}", updated.id(), updated.bayNumber());
        return WashBayResponse.of(updated);
    }

    /**
     * Soft delete: the row stays for booking history, status becomes inactive.
     */
    @Transactional
    public WashBayDeletedResponse delete(UUID id) {
        WashBay existing = requireBay(id);
        int deleted = dao.softDelete(existing.id());
        if (deleted == 0) {
            throw ApiException.notFound("Mycí box nebyl nalezen.", "wash_bay");
        }
        log.info("Wash bay soft-deleted id={} number={}", existing.id(), existing.bayNumber());
        return new WashBayDeletedResponse(existing.id(), existing.bayNumber(), true,
                "Mycí box '" + existing.bayNumber() + "' byl deaktivován.");
    }

    private WashBay requireBay(UUID id) {
        return dao.findById(id)
                .orElseThrow(() -> ApiException.notFound("Mycí box nebyl nalezen.", "wash_bay"));
    }

    private void ensureBayNumberUnique(String bayNumber, UUID currentId) {
        dao.findByBayNumber(bayNumber)
                .filter(other -> !other.id().equals(currentId))
                .ifPresent(other -> {
                    throw ApiException.conflict("Mycí box s číslem '" + bayNumber + "' již existuje.", "bay_number_taken");
                });
    }

    public record WashBayDeletedResponse(@JsonProperty("id") UUID id,
                                         @JsonProperty("bay_number") String bayNumber,
                                         @JsonProperty("deleted") boolean deleted,
                                         @JsonProperty("message") String message) {}
}
