package czm.carwash_be.capacity;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.OffsetDateTime;
import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class CapacityControllerIntegrationTest {

    private static final DockerImageName POSTGRES_IMAGE = DockerImageName
            .parse("postgres:16-alpine")
            .asCompatibleSubstituteFor("postgres");

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>(POSTGRES_IMAGE);

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        if (!POSTGRES.isRunning()) {
            POSTGRES.start();
        }
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
        registry.add("spring.flyway.enabled", () -> "true");
        registry.add("spring.flyway.locations", () -> "classpath:db/migration");
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanDatabase() {
        jdbcTemplate.execute("TRUNCATE booking, wash_bay, mobile_team");
    }

    @Test
    void resourceAvailabilityTreatsTouchingBookingsAsFree() throws Exception {
        UUID bay = insertBay("B1", "standard", "active");
        insertBooking(bay, "2024-01-01T09:00:00Z", 30, "confirmed");

        mockMvc.perform(get("/api/capacity/resources/{id}/availability", bay)
                        .param("scheduled_at", "2024-01-01T09:15:00Z")
                        .param("duration_minutes", "30"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.available").value(false));

        mockMvc.perform(get("/api/capacity/resources/{id}/availability", bay)
                        .param("scheduled_at", "2024-01-01T09:30:00Z")
                        .param("duration_minutes", "30"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.available").value(true));
    }

    @Test
    void cancelledAndExcludedBookingsDoNotBlock() throws Exception {
        UUID bay = insertBay("B1", "standard", "active");
        insertBooking(bay, "2024-01-01T09:00:00Z", 60, "cancelled");
        UUID own = insertBooking(bay, "2024-01-01T09:00:00Z", 60, "confirmed");

        mockMvc.perform(get("/api/capacity/resources/{id}/availability", bay)
                        .param("scheduled_at", "2024-01-01T09:00:00Z")
                        .param("duration_minutes", "60")
                        .param("exclude_booking_id", own.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.available").value(true));
    }

    @Test
    void softDeletedResourceIsNotFound() throws Exception {
        UUID bay = insertBay("B1", "standard", "active");
        jdbcTemplate.update("UPDATE wash_bay SET deleted_at = now(), status = 'inactive' WHERE id = ?", bay);

        mockMvc.perform(get("/api/capacity/resources/{id}/availability", bay)
                        .param("scheduled_at", "2024-01-01T09:00:00Z")
                        .param("duration_minutes", "30"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }

    @Test
    void availableBayIgnoresSmallerFreeBay() throws Exception {
        insertBay("B1", "standard", "active");
        UUID large = insertBay("B2", "large", "active");
        insertBooking(large, "2024-01-01T09:00:00Z", 60, "in_progress");

        mockMvc.perform(get("/api/capacity/available-bay")
                        .param("scheduled_at", "2024-01-01T09:00:00Z")
                        .param("duration_minutes", "30")
                        .param("vehicle_size", "large"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.found").value(false));

        mockMvc.perform(get("/api/capacity/available-bay")
                        .param("scheduled_at", "2024-01-01T09:00:00Z")
                        .param("duration_minutes", "30")
                        .param("vehicle_size", "compact"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.found").value(true))
                .andExpect(jsonPath("$.resource_id").isNotEmpty());
    }

    @Test
    void unknownVehicleSizeIsRejected() throws Exception {
        mockMvc.perform(get("/api/capacity/available-bay")
                        .param("scheduled_at", "2024-01-01T09:00:00Z")
                        .param("duration_minutes", "30")
                        .param("vehicle_size", "truck"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION"))
                .andExpect(jsonPath("$.error.details").value("vehicle_size_invalid"));
    }

    @Test
    void snapshotReportsUtilization() throws Exception {
        UUID first = insertBay("B1", "standard", "active");
        insertBay("B2", "large", "active");
        insertBay("B3", "large", "maintenance");
        insertBooking(first, "2024-01-01T08:45:00Z", 30, "pending");

        mockMvc.perform(get("/api/capacity/snapshot")
                        .param("scheduled_at", "2024-01-01T09:00:00Z")
                        .param("duration_minutes", "30"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_bays").value(2))
                .andExpect(jsonPath("$.available_bays").value(1))
                .andExpect(jsonPath("$.booked_bays").value(1))
                .andExpect(jsonPath("$.utilization_percent").value(50.0))
                .andExpect(jsonPath("$.bay_details", hasSize(2)))
                .andExpect(jsonPath("$.bay_details[0].bay_number").value("B1"))
                .andExpect(jsonPath("$.bay_details[0].is_available").value(false));

        mockMvc.perform(get("/api/capacity/available-count")
                        .param("scheduled_at", "2024-01-01T09:00:00Z")
                        .param("duration_minutes", "30"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.available_capacity").value(1));
    }

    @Test
    void timeSlotsSkipFullyBookedStep() throws Exception {
        UUID bay = insertBay("B1", "standard", "active");
        insertBooking(bay, "2024-01-01T10:00:00Z", 30, "confirmed");

        mockMvc.perform(get("/api/capacity/time-slots")
                        .param("start_date", "2024-01-01T09:00:00Z")
                        .param("end_date", "2024-01-01T11:00:00Z")
                        .param("duration_minutes", "30")
                        .param("slot_interval_minutes", "60"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].available_capacity").value(1))
                .andExpect(jsonPath("$[1].duration_minutes").value(30));

        mockMvc.perform(get("/api/capacity/time-slots")
                        .param("start_date", "2024-01-01T11:00:00Z")
                        .param("end_date", "2024-01-01T09:00:00Z")
                        .param("duration_minutes", "30"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.details").value("interval_invalid"));
    }

    @Test
    void availableMobileTeamCoversCustomer() throws Exception {
        UUID team = jdbcTemplate.queryForObject(
                "INSERT INTO mobile_team (team_name, base_latitude, base_longitude, service_radius_km) VALUES (?, ?, ?, ?) RETURNING id",
                UUID.class, "Praha Sever", 50.0875, 14.4213, 30);

        mockMvc.perform(get("/api/capacity/available-mobile-team")
                        .param("latitude", "50.1000")
                        .param("longitude", "14.5000")
                        .param("scheduled_at", "2024-01-01T09:00:00Z")
                        .param("duration_minutes", "90"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.found").value(true))
                .andExpect(jsonPath("$.resource_id").value(team.toString()));

        mockMvc.perform(get("/api/capacity/available-mobile-team")
                        .param("latitude", "49.1951")
                        .param("longitude", "16.6068")
                        .param("scheduled_at", "2024-01-01T09:00:00Z")
                        .param("duration_minutes", "90"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.found").value(false));
    }

    private UUID insertBay(String number, String maxSize, String status) {
        return jdbcTemplate.queryForObject(
                "INSERT INTO wash_bay (bay_number, max_vehicle_size, status) VALUES (?, ?, ?) RETURNING id",
                UUID.class, number, maxSize, status);
    }

    private UUID insertBooking(UUID resourceId, String scheduledAt, int minutes, String status) {
        return jdbcTemplate.queryForObject(
                "INSERT INTO booking (resource_id, scheduled_at, estimated_duration_minutes, status) VALUES (?, ?, ?, ?) RETURNING id",
                UUID.class, resourceId, OffsetDateTime.parse(scheduledAt), minutes, status);
    }
}
