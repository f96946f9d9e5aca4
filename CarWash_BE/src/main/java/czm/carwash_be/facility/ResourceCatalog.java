package czm.carwash_be.facility;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only view of the schedulable resources used by availability resolution.
 *
 * <p>Only active, non-deleted resources are ever returned. Bay lists are ordered by bay number so that
 * first-fit selection over them is stable between calls.</p>
 */
@Component
public class ResourceCatalog {

    private final WashBayDao washBayDao;
    private final MobileTeamDao mobileTeamDao;

    public ResourceCatalog(WashBayDao washBayDao, MobileTeamDao mobileTeamDao) {
        this.washBayDao = washBayDao;
        this.mobileTeamDao = mobileTeamDao;
    }

    public List<WashBay> listCompatibleBays(VehicleSize vehicleSize) {
        Objects.requireNonNull(vehicleSize, "vehicleSize");
        return washBayDao.listActiveByRatings(VehicleSize.ratingsAccommodating(vehicleSize));
    }

    public List<WashBay> listActiveBays() {
        return washBayDao.listActive();
    }

    /**
     * Active teams whose service radius covers {@code location}, nearest service area first
     * (smaller radius, then team name).
     */
    public List<MobileTeam> listTeamsWithinRadius(GeoLocation location) {
        Objects.requireNonNull(location, "location");
        return mobileTeamDao.listActive().stream()
                .filter(team -> team.canService(location))
                .sorted(Comparator.comparing(MobileTeam::serviceRadiusKm)
                        .thenComparing(MobileTeam::teamName))
                .toList();
    }

    /**
     * Looks the id up among non-deleted bays first, then among non-deleted mobile teams.
     */
    public Optional<SchedulableResource> findResource(UUID resourceId) {
        Optional<SchedulableResource> bay = washBayDao.findById(resourceId).map(SchedulableResource.class::cast);
        if (bay.isPresent()) {
            return bay;
        }
        return mobileTeamDao.findById(resourceId).map(SchedulableResource.class::cast);
    }
}
