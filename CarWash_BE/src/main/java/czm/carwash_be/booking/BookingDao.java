package czm.carwash_be.booking;

import czm.carwash_be.capacity.BookingStatus;
import org.springframework.dao.support.DataAccessUtils;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Booking access needed by resource assignment: reading one booking and writing its {@code resource_id}.
 */
@Repository
public class BookingDao {

    private static final String SQL_SELECT_BY_ID =
            """
            SELECT id,
                   resource_id,
                   vehicle_size,
                   scheduled_at,
                   estimated_duration_minutes,
                   status
            FROM booking
            WHERE id = ?
            """;

    private static final String SQL_ASSIGN_RESOURCE =
            """
            UPDATE booking
            SET resource_id = ?,
                updated_at  = now()
            WHERE id = ?
            """;

    private static final String SQL_ADVISORY_LOCK = "SELECT pg_advisory_xact_lock(?)";

    private static final RowMapper<BookingRow> BOOKING_MAPPER = (rs, rowNum) -> {
        String statusCode = rs.getString("status");
        return new BookingRow(
                rs.getObject("id", UUID.class),
                rs.getObject("resource_id", UUID.class),
                rs.getString("vehicle_size"),
                rs.getObject("scheduled_at", OffsetDateTime.class),
                rs.getInt("estimated_duration_minutes"),
                BookingStatus.fromCode(statusCode)
                        .orElseThrow(() -> new SQLException("Unknown booking status " + statusCode)));
    };

    private final JdbcTemplate jdbc;

    public BookingDao(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<BookingRow> findById(UUID bookingId) {
        List<BookingRow> rows = jdbc.query(SQL_SELECT_BY_ID, BOOKING_MAPPER, bookingId);
        return Optional.ofNullable(DataAccessUtils.singleResult(rows));
    }

    public int assignResource(UUID bookingId, UUID resourceId) {
        return jdbc.update(SQL_ASSIGN_RESOURCE, resourceId, bookingId);
    }

    /**
     * Blocks until the transaction-scoped advisory lock for the resource is held. Released on commit or rollback,
     * so it must run inside a transaction.
     */
    public void lockResource(UUID resourceId) {
        jdbc.queryForList(SQL_ADVISORY_LOCK, advisoryLockKey(resourceId));
    }

    static long advisoryLockKey(UUID resourceId) {
        return resourceId.getMostSignificantBits() ^ resourceId.getLeastSignificantBits();
    }

    public record BookingRow(UUID id,
                             UUID resourceId,
                             String vehicleSize,
                             OffsetDateTime scheduledAt,
                             int durationMinutes,
                             BookingStatus status) {}
}
