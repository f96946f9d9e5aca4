package czm.carwash_be.facility;

import org.springframework.dao.support.DataAccessUtils;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Data-access component for the {@code mobile_team} table.
 */
@Repository
public class MobileTeamDao {

    private static final String SQL_SELECT_BASE =
            """
            SELECT id,
                   team_name,
                   base_latitude,
                   base_longitude,
                   service_radius_km,
                   daily_capacity,
                   equipment_types,
                   status,
                   created_at,
                   updated_at,
                   deleted_at
            FROM mobile_team
            """;

    private static final String SQL_SELECT_BY_ID =
            SQL_SELECT_BASE +
            " WHERE id = ? AND deleted_at IS NULL";

    private static final String SQL_SELECT_BY_NAME =
            SQL_SELECT_BASE +
            " WHERE team_name = ? AND deleted_at IS NULL";

    // Vzdálenost se počítá až v Javě, teamů je řádově jednotky.
    private static final String SQL_SELECT_ACTIVE =
            SQL_SELECT_BASE +
            " WHERE status = 'active' AND deleted_at IS NULL\n" +
            " ORDER BY team_name ASC, id ASC";

    private static final String SQL_COUNT_BY_STATUS =
            """
            SELECT status, COUNT(*) AS status_count
            FROM mobile_team
            WHERE deleted_at IS NULL
            GROUP BY status
            """;

    private static final String SQL_INSERT =
            """
            INSERT INTO mobile_team (team_name, base_latitude, base_longitude, service_radius_km, daily_capacity,
                                     equipment_types, status)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            RETURNING id, team_name, base_latitude, base_longitude, service_radius_km, daily_capacity, equipment_types,
                      status, created_at, updated_at, deleted_at
            """;

    private static final String SQL_UPDATE =
            """
            UPDATE mobile_team
            SET team_name         = ?,
                base_latitude     = ?,
                base_longitude    = ?,
                service_radius_km = ?,
                daily_capacity    = ?,
                equipment_types   = ?,
                status            = ?,
                updated_at        = now()
            WHERE id = ? AND deleted_at IS NULL
            RETURNING id, team_name, base_latitude, base_longitude, service_radius_km, daily_capacity, equipment_types,
                      status, created_at, updated_at, deleted_at
            """;

    private static final String SQL_SOFT_DELETE =
            """
            UPDATE mobile_team
            SET deleted_at = now(),
                status     = 'inactive',
                updated_at = now()
            WHERE id = ? AND deleted_at IS NULL
            """;

    private static final RowMapper<MobileTeam> ROW_MAPPER = new RowMapper<>() {
        @Override
        public MobileTeam mapRow(ResultSet rs, int rowNum) throws SQLException {
            String statusCode = rs.getString("status");
            return new MobileTeam(
                    rs.getObject("id", UUID.class),
                    rs.getString("team_name"),
                    new GeoLocation(rs.getBigDecimal("base_latitude"), rs.getBigDecimal("base_longitude")),
                    rs.getBigDecimal("service_radius_km"),
                    rs.getInt("daily_capacity"),
                    WashBayDao.readTextArray(rs.getArray("equipment_types")),
                    ResourceStatus.fromCode(statusCode)
                            .orElseThrow(() -> new SQLException("Unknown mobile team status " + statusCode)),
                    rs.getObject("created_at", OffsetDateTime.class),
                    rs.getObject("updated_at", OffsetDateTime.class),
                    rs.getObject("deleted_at", OffsetDateTime.class));
        }
    };

    private final JdbcTemplate jdbc;

    public MobileTeamDao(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<MobileTeam> findById(UUID id) {
        List<MobileTeam> rows = jdbc.query(SQL_SELECT_BY_ID, ROW_MAPPER, id);
        return Optional.ofNullable(DataAccessUtils.singleResult(rows));
    }

    public Optional<MobileTeam> findByTeamName(String teamName) {
        List<MobileTeam> rows = jdbc.query(SQL_SELECT_BY_NAME, ROW_MAPPER, teamName);
        return Optional.ofNullable(DataAccessUtils.singleResult(rows));
    }

    public List<MobileTeam> listActive() {
        return jdbc.query(SQL_SELECT_ACTIVE, ROW_MAPPER);
    }

    public List<MobileTeam> list(ResourceStatus status, boolean includeDeleted) {
        StringBuilder sql = new StringBuilder(SQL_SELECT_BASE);
        List<Object> params = new ArrayList<>();
        List<String> conditions = new ArrayList<>();
        if (!includeDeleted) {
            conditions.add("deleted_at IS NULL");
        }
        if (status != null) {
            conditions.add("status = ?");
            params.add(status.code());
        }
        if (!conditions.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", conditions));
        }
        sql.append("\n ORDER BY team_name ASC, id ASC");
        return jdbc.query(sql.toString(), ROW_MAPPER, params.toArray());
    }

    public Map<ResourceStatus, Long> countByStatus() {
        Map<ResourceStatus, Long> counts = new EnumMap<>(ResourceStatus.class);
        counts.put(ResourceStatus.ACTIVE, 0L);
        counts.put(ResourceStatus.INACTIVE, 0L);
        jdbc.query(SQL_COUNT_BY_STATUS, rs -> {
            long count = rs.getLong("status_count");
            ResourceStatus.fromCode(rs.getString("status"))
                    .ifPresent(status -> counts.put(status, count));
        });
        return counts;
    }

    public MobileTeam insert(String teamName,
                             GeoLocation baseLocation,
                             BigDecimal serviceRadiusKm,
                             int dailyCapacity,
                             List<String> equipmentTypes,
                             ResourceStatus status) {
        Objects.requireNonNull(teamName, "teamName");
        Objects.requireNonNull(baseLocation, "baseLocation");
        Objects.requireNonNull(status, "status");
        return jdbc.queryForObject(SQL_INSERT, ROW_MAPPER,
                teamName,
                baseLocation.latitude(),
                baseLocation.longitude(),
                serviceRadiusKm,
                dailyCapacity,
                WashBayDao.toTextArray(equipmentTypes),
                status.code());
    }

    public Optional<MobileTeam> update(UUID id,
                                       String teamName,
                                       GeoLocation baseLocation,
                                       BigDecimal serviceRadiusKm,
                                       int dailyCapacity,
                                       List<String> equipmentTypes,
                                       ResourceStatus status) {
        Objects.requireNonNull(teamName, "teamName");
        Objects.requireNonNull(baseLocation, "baseLocation");
        Objects.requireNonNull(status, "status");
        List<MobileTeam> rows = jdbc.query(SQL_UPDATE, ROW_MAPPER,
                teamName,
                baseLocation.latitude(),
                baseLocation.longitude(),
                serviceRadiusKm,
                dailyCapacity,
                WashBayDao.toTextArray(equipmentTypes),
                status.code(),
                id);
        return Optional.ofNullable(DataAccessUtils.singleResult(rows));
    }

    public int softDelete(UUID id) {
        return jdbc.update(SQL_SOFT_DELETE, id);
    }
}
