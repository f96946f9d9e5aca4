package czm.carwash_be.capacity;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read-only access to bookings that currently hold a resource.
 *
 * <p>The start-time window only bounds the query (index {@code booking(resource_id, scheduled_at)});
 * the overlap decision itself is made by the caller on the returned intervals.</p>
 */
@Repository
public class OccupancyDao {

    private static final String OCCUPYING_STATUS_CODES = BookingStatus.occupying().stream()
            .map(status -> "'" + status.code() + "'")
            .collect(Collectors.joining(", "));

    private static final String SQL_OCCUPYING_BASE =
            """
            SELECT b.id,
                   b.scheduled_at,
                   b.estimated_duration_minutes
            FROM booking b
            WHERE b.resource_id = ?
              AND b.status IN (%s)
              AND b.scheduled_at >= ?
              AND b.scheduled_at <= ?
            """.formatted(OCCUPYING_STATUS_CODES);

    private static final RowMapper<OccupancyRow> OCCUPANCY_MAPPER = (rs, rowNum) -> new OccupancyRow(
            rs.getObject("id", UUID.class),
            rs.getObject("scheduled_at", OffsetDateTime.class),
            rs.getInt("estimated_duration_minutes"));

    private final JdbcTemplate jdbc;

    public OccupancyDao(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<OccupancyRow> listOccupying(UUID resourceId,
                                            OffsetDateTime windowFrom,
                                            OffsetDateTime windowTo,
                                            UUID excludeBookingId) {
        StringBuilder sql = new StringBuilder(SQL_OCCUPYING_BASE);
        List<Object> params = new ArrayList<>();
        params.add(resourceId);
        params.add(windowFrom);
        params.add(windowTo);
        if (excludeBookingId != null) {
            sql.append("  AND b.id <> ?\n");
            params.add(excludeBookingId);
        }
        sql.append("ORDER BY b.scheduled_at ASC");
        return jdbc.query(sql.toString(), OCCUPANCY_MAPPER, params.toArray());
    }

    public record OccupancyRow(UUID bookingId, OffsetDateTime scheduledAt, int durationMinutes) {

        public TimeInterval interval() {
            return TimeInterval.ofMinutes(scheduledAt, durationMinutes);
        }
    }
}
