package czm.carwash_be.facility;

import com.fasterxml.jackson.annotation.JsonProperty;
import czm.carwash_be.config.CapacityProperties;
import czm.carwash_be.web.ApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Application service for mobile wash teams, including the service-area lookup for a customer location.
 */
@Service
public class MobileTeamService {
    private static final Logger log = LoggerFactory.getLogger(MobileTeamService.class);
    private static final int MAX_TEAM_NAME_LENGTH = 100;
    private static final BigDecimal MIN_RADIUS_KM = new BigDecimal("0.01");
    private static final BigDecimal MAX_RADIUS_KM = new BigDecimal("9999.99");
    /** Týmy nemají stav maintenance. */
    private static final Set<ResourceStatus> TEAM_STATUSES = EnumSet.of(ResourceStatus.ACTIVE, ResourceStatus.INACTIVE);

    private final MobileTeamDao dao;
    private final ResourceCatalog catalog;
    private final CapacityProperties properties;

    public MobileTeamService(MobileTeamDao dao, ResourceCatalog catalog, CapacityProperties properties) {
        this.dao = dao;
        this.catalog = catalog;
        this.properties = properties;
    }

    @Transactional
    public MobileTeamResponse create(MobileTeamRequest request) {
        if (request == null) {
            throw ApiException.validation("Request nesmí být prázdný.", "request_required");
        }
        String teamName = FacilityInput.requireName(request.teamName(), MAX_TEAM_NAME_LENGTH, "Název týmu", "team_name");
        GeoLocation base = FacilityInput.requireLocation(request.baseLatitude(), request.baseLongitude());
        BigDecimal radius = validateRadius(request.serviceRadiusKm() != null
                ? request.serviceRadiusKm()
                : properties.getDefaultTeamRadiusKm());
        int dailyCapacity = validateDailyCapacity(request.dailyCapacity() != null
                ? request.dailyCapacity()
                : properties.getDefaultTeamDailyCapacity());
        List<String> equipment = FacilityInput.normalizeEquipment(request.equipmentTypes());
        ResourceStatus status = FacilityInput.parseStatus(request.status(), TEAM_STATUSES);
        ensureTeamNameUnique(teamName, null);

        MobileTeam inserted = dao.insert(teamName, base, radius, dailyCapacity, equipment,
                status != null ? status : ResourceStatus.ACTIVE);
        log.info("Mobile team created id={} name={} radiusKm={}", inserted.id(), inserted.teamName(), inserted.serviceRadiusKm());
        return MobileTeamResponse.of(inserted);
    }

    public MobileTeamResponse get(UUID id) {
        return MobileTeamResponse.of(requireTeam(id));
    }

    public MobileTeamListResponse list(String statusCode, boolean includeDeleted) {
        ResourceStatus status = FacilityInput.parseStatus(statusCode, TEAM_STATUSES);
        List<MobileTeamResponse> teams = dao.list(status, includeDeleted).stream()
                .map(MobileTeamResponse::of)
                .toList();
        Map<ResourceStatus, Long> counts = dao.countByStatus();
        return new MobileTeamListResponse(
                teams,
                teams.size(),
                counts.getOrDefault(ResourceStatus.ACTIVE, 0L),
                counts.getOrDefault(ResourceStatus.INACTIVE, 0L));
    }

    @Transactional
    public MobileTeamResponse update(UUID id, MobileTeamRequest request) {
        if (request == null) {
            throw ApiException.validation("Request nesmí být prázdný.", "request_required");
        }
        MobileTeam existing = requireTeam(id);

        String teamName = request.teamName() != null
                ? FacilityInput.requireName(request.teamName(), MAX_TEAM_NAME_LENGTH, "Název týmu", "team_name")
                : existing.teamName();
        GeoLocation base = request.baseLatitude() != null || request.baseLongitude() != null
                ? FacilityInput.requireLocation(
                        request.baseLatitude() != null ? request.baseLatitude() : existing.baseLocation().latitude(),
                        request.baseLongitude() != null ? request.baseLongitude() : existing.baseLocation().longitude())
                : existing.baseLocation();
        BigDecimal radius = request.serviceRadiusKm() != null
                ? validateRadius(request.serviceRadiusKm())
                : existing.serviceRadiusKm();
        int dailyCapacity = request.dailyCapacity() != null
                ? validateDailyCapacity(request.dailyCapacity())
                : existing.dailyCapacity();
        List<String> equipment = request.equipmentTypes() != null
                ? FacilityInput.normalizeEquipment(request.equipmentTypes())
                : existing.equipmentTypes();
        ResourceStatus requestedStatus = FacilityInput.parseStatus(request.status(), TEAM_STATUSES);
        ResourceStatus status = requestedStatus != null ? requestedStatus : existing.status();

        if (!teamName.equals(existing.teamName())) {
            ensureTeamNameUnique(teamName, existing.id());
        }

        MobileTeam updated = dao.update(existing.id(), teamName, base, radius, dailyCapacity, equipment, status)
                .orElseThrow(() -> ApiException.notFound("Mobilní tým nebyl nalezen.", "mobile_team"));
        log.info("Mobile team updated id={} name={} status={}", updated.id(), updated.teamName(), updated.status().code());
        return MobileTeamResponse.of(updated);
    }

    @Transactional
    public MobileTeamDeletedResponse delete(UUID id) {
        MobileTeam existing = requireTeam(id);
        int deleted = dao.softDelete(existing.id());
        if (deleted == 0) {
            throw ApiException.notFound("Mobilní tým nebyl nalezen.", "mobile_team");
        }
        log.info("Mobile team soft-deleted id={} name={}", existing.id(), existing.teamName());
        return new MobileTeamDeletedResponse(existing.id(), existing.teamName(), true,
                "Mobilní tým '" + existing.teamName() + "' byl deaktivován.");
    }

    /**
     * Active teams able to reach the customer location, with the distance from their base.
     */
    public List<TeamCoverageResponse> listWithinRadius(BigDecimal latitude, BigDecimal longitude) {
        GeoLocation location = FacilityInput.requireLocation(latitude, longitude);
        return catalog.listTeamsWithinRadius(location).stream()
                .map(team -> new TeamCoverageResponse(
                        MobileTeamResponse.of(team),
                        BigDecimal.valueOf(team.distanceKmTo(location)).setScale(2, RoundingMode.HALF_UP)))
                .toList();
    }

    private MobileTeam requireTeam(UUID id) {
        return dao.findById(id)
                .orElseThrow(() -> ApiException.notFound("Mobilní tým nebyl nalezen.", "mobile_team"));
    }

    private void ensureTeamNameUnique(String teamName, UUID currentId) {
        dao.findByTeamName(teamName)
                .filter(other -> !other.id().equals(currentId))
                .ifPresent(other -> {
                    throw ApiException.conflict("Mobilní tým '" + teamName + "' již existuje.", "team_name_taken");
                });
    }

    private static BigDecimal validateRadius(BigDecimal radius) {
        // Sloupec je NUMERIC(6, 2), hodnota musí projít beze zaokrouhlení.
        if (radius.compareTo(MIN_RADIUS_KM) < 0 || radius.compareTo(MAX_RADIUS_KM) > 0
                || radius.stripTrailingZeros().scale() > 2) {
            throw ApiException.validation(
                    "Dosah služby musí být v rozmezí 0,01 až 9999,99 km s nejvýše dvěma desetinnými místy.",
                    "service_radius_invalid");
        }
        return radius;
    }

    private static int validateDailyCapacity(int dailyCapacity) {
        if (dailyCapacity <= 0) {
            throw ApiException.validation("Denní kapacita musí být kladná.", "daily_capacity_invalid");
        }
        return dailyCapacity;
    }

    public record MobileTeamDeletedResponse(@JsonProperty("id") UUID id,
                                            @JsonProperty("team_name") String teamName,
                                            @JsonProperty("deleted") boolean deleted,
                                            @JsonProperty("message") String message) {}

    public record TeamCoverageResponse(@JsonProperty("team") MobileTeamResponse team,
                                       @JsonProperty("distance_km") BigDecimal distanceKm) {}
}
