package czm.carwash_be.facility;

import org.springframework.dao.support.DataAccessUtils;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Data-access component for the {@code wash_bay} table.
 *
 * <p>Soft-deleted rows ({@code deleted_at IS NOT NULL}) are invisible to every lookup except the
 * administrative list with {@code includeDeleted}.</p>
 */
@Repository
public class WashBayDao {

    private static final String SQL_SELECT_BASE =
            """
            SELECT id,
                   bay_number,
                   max_vehicle_size,
                   equipment_types,
                   status,
                   location_latitude,
                   location_longitude,
                   created_at,
                   updated_at,
                   deleted_at
            FROM wash_bay
            """;

    private static final String SQL_SELECT_BY_ID =
            SQL_SELECT_BASE +
            " WHERE id = ? AND deleted_at IS NULL";

    private static final String SQL_SELECT_BY_NUMBER =
            SQL_SELECT_BASE +
            " WHERE bay_number = ? AND deleted_at IS NULL";

    private static final String SQL_SELECT_ACTIVE =
            SQL_SELECT_BASE +
            " WHERE status = 'active' AND deleted_at IS NULL\n" +
            " ORDER BY bay_number ASC, id ASC";

    private static final String SQL_SELECT_ACTIVE_BY_SIZES =
            SQL_SELECT_BASE +
            " WHERE status = 'active' AND deleted_at IS NULL AND max_vehicle_size = ANY (?)\n" +
            " ORDER BY bay_number ASC, id ASC";

    private static final String SQL_COUNT_BY_STATUS =
            """
            SELECT status, COUNT(*) AS status_count
            FROM wash_bay
            WHERE deleted_at IS NULL
            GROUP BY status
            """;

    private static final String SQL_INSERT =
            """
            INSERT INTO wash_bay (bay_number, max_vehicle_size, equipment_types, status, location_latitude, location_longitude)
            VALUES (?, ?, ?, ?, ?, ?)
            RETURNING id, bay_number, max_vehicle_size, equipment_types, status, location_latitude, location_longitude,
                      created_at, updated_at, deleted_at
            """;

    private static final String SQL_UPDATE =
            """
            UPDATE wash_bay
            SET bay_number         = ?,
                max_vehicle_size   = ?,
                equipment_types    = ?,
                status             = ?,
                location_latitude  = ?,
                location_longitude = ?,
                updated_at         = now()
            WHERE id = ? AND deleted_at IS NULL
            RETURNING id, bay_number, max_vehicle_size, equipment_types, status, location_latitude, location_longitude,
                      created_at, updated_at, deleted_at
            """;

    private static final String SQL_SOFT_DELETE =
            """
            UPDATE wash_bay
            SET deleted_at = now(),
                status     = 'inactive',
                updated_at = now()
            WHERE id = ? AND deleted_at IS NULL
            """;

    static final RowMapper<WashBay> ROW_MAPPER = new RowMapper<>() {
        @Override
        public WashBay mapRow(ResultSet rs, int rowNum) throws SQLException {
            BigDecimal latitude = rs.getBigDecimal("location_latitude");
            BigDecimal longitude = rs.getBigDecimal("location_longitude");
            GeoLocation location = latitude != null && longitude != null ? new GeoLocation(latitude, longitude) : null;
            String sizeCode = rs.getString("max_vehicle_size");
            String statusCode = rs.getString("status");
            return new WashBay(
                    rs.getObject("id", UUID.class),
                    rs.getString("bay_number"),
                    VehicleSize.fromCode(sizeCode)
                            .orElseThrow(() -> new SQLException("Unknown max_vehicle_size " + sizeCode)),
                    readTextArray(rs.getArray("equipment_types")),
                    ResourceStatus.fromCode(statusCode)
                            .orElseThrow(() -> new SQLException("Unknown wash bay status " + statusCode)),
                    location,
                    rs.getObject("created_at", OffsetDateTime.class),
                    rs.getObject("updated_at", OffsetDateTime.class),
                    rs.getObject("deleted_at", OffsetDateTime.class));
        }
    };

    private final JdbcTemplate jdbc;

    public WashBayDao(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<WashBay> findById(UUID id) {
        List<WashBay> rows = jdbc.query(SQL_SELECT_BY_ID, ROW_MAPPER, id);
        return Optional.ofNullable(DataAccessUtils.singleResult(rows));
    }

    public Optional<WashBay> findByBayNumber(String bayNumber) {
        List<WashBay> rows = jdbc.query(SQL_SELECT_BY_NUMBER, ROW_MAPPER, bayNumber);
        return Optional.ofNullable(DataAccessUtils.singleResult(rows));
    }

    /**
     * Active, non-deleted bays ordered by bay number.
     */
    public List<WashBay> listActive() {
        return jdbc.query(SQL_SELECT_ACTIVE, ROW_MAPPER);
    }

    /**
     * Active, non-deleted bays whose rating is one of {@code ratings}, ordered by bay number.
     */
    public List<WashBay> listActiveByRatings(Collection<VehicleSize> ratings) {
        if (ratings == null || ratings.isEmpty()) {
            return List.of();
        }
        String[] codes = ratings.stream().map(VehicleSize::code).toArray(String[]::new);
        return jdbc.query(SQL_SELECT_ACTIVE_BY_SIZES, ROW_MAPPER, (Object) codes);
    }

    public List<WashBay> list(ResourceStatus status, boolean includeDeleted) {
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
        sql.append("\n ORDER BY bay_number ASC, id ASC");
        return jdbc.query(sql.toString(), ROW_MAPPER, params.toArray());
    }

    public Map<ResourceStatus, Long> countByStatus() {
        Map<ResourceStatus, Long> counts = new EnumMap<>(ResourceStatus.class);
        for (ResourceStatus status : ResourceStatus.values()) {
            counts.put(status, 0L);
        }
        jdbc.query(SQL_COUNT_BY_STATUS, rs -> {
            long count = rs.getLong("status_count");
            ResourceStatus.fromCode(rs.getString("status"))
                    .ifPresent(status -> counts.put(status, count));
        });
        return counts;
    }

    public WashBay insert(String bayNumber,
                          VehicleSize maxVehicleSize,
                          List<String> equipmentTypes,
                          ResourceStatus status,
                          GeoLocation location) {
        Objects.requireNonNull(bayNumber, "bayNumber");
        Objects.requireNonNull(maxVehicleSize, "maxVehicleSize");
        Objects.requireNonNull(status, "status");
        return jdbc.queryForObject(SQL_INSERT, ROW_MAPPER,
                bayNumber,
                maxVehicleSize.code(),
                toTextArray(equipmentTypes),
                status.code(),
                location != null ? location.latitude() : null,
                location != null ? location.longitude() : null);
    }

    public Optional<WashBay> update(UUID id,
                                    String bayNumber,
                                    VehicleSize maxVehicleSize,
                                    List<String> equipmentTypes,
                                    ResourceStatus status,
                                    GeoLocation location) {
        Objects.requireNonNull(bayNumber, "bayNumber");
        Objects.requireNonNull(maxVehicleSize, "maxVehicleSize");
        Objects.requireNonNull(status, "status");
        List<WashBay> rows = jdbc.query(SQL_UPDATE, ROW_MAPPER,
                bayNumber,
                maxVehicleSize.code(),
                toTextArray(equipmentTypes),
                status.code(),
                location != null ? location.latitude() : null,
                location != null ? location.longitude() : null,
                id);
        return Optional.ofNullable(DataAccessUtils.singleResult(rows));
    }

    public int softDelete(UUID id) {
        return jdbc.update(SQL_SOFT_DELETE, id);
    }

    static String[] toTextArray(List<String> values) {
        return values == null ? new String[0] : values.toArray(String[]::new);
    }

    static List<String> readTextArray(Array sqlArray) throws SQLException {
        if (sqlArray == null) {
            return List.of();
        }
        Object array = sqlArray.getArray();
        if (array instanceof String[] strings) {
            return Arrays.stream(strings).filter(Objects::nonNull).toList();
        } else if (array instanceof Object[] objects) {
            return Arrays.stream(objects).filter(Objects::nonNull).map(Object::toString).toList();
        }
        return List.of();
    }
}
