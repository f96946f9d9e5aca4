package czm.carwash_be.facility;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A resource a booking can be assigned to: either a fixed {@link WashBay} or a {@link MobileTeam}.
 *
 * <p>The variants share identity and lifecycle only; their compatibility rules (size hierarchy versus
 * service radius) live on the variant records.</p>
 */
public sealed interface SchedulableResource permits WashBay, MobileTeam {

    UUID id();

    ResourceKind kind();

    ResourceStatus status();

    OffsetDateTime deletedAt();

    /** Human readable identifier (bay number or team name). */
    String label();

    /**
     * Only active, non-deleted resources are offered by first-fit selection and capacity counts.
     */
    default boolean isBookable() {
        return status() == ResourceStatus.ACTIVE && deletedAt() == null;
    }
}
