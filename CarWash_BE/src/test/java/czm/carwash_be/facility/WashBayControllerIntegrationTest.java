package czm.carwash_be.facility;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class WashBayControllerIntegrationTest {

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

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private WashBayDao washBayDao;

    @BeforeEach
    void cleanDatabase() {
        jdbcTemplate.execute("TRUNCATE booking, wash_bay, mobile_team");
    }

    @Test
    void createListUpdateAndSoftDelete() throws Exception {
        String created = mockMvc.perform(post("/api/facilities/wash-bays")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"bay_number": "B1", "max_vehicle_size": "large",
                                 "equipment_types": ["foam", "dryer"], "latitude": 50.0755, "longitude": 14.4378}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("active"))
                .andExpect(jsonPath("$.equipment_types", hasSize(2)))
                .andReturn().getResponse().getContentAsString();
        String id = objectMapper.readTree(created).get("id").asText();

        mockMvc.perform(post("/api/facilities/wash-bays")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"bay_number\": \"B1\", \"max_vehicle_size\": \"standard\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.details").value("bay_number_taken"));

        mockMvc.perform(patch("/api/facilities/wash-bays/{id}", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"maintenance\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("maintenance"))
                .andExpect(jsonPath("$.max_vehicle_size").value("large"));

        mockMvc.perform(get("/api/facilities/wash-bays"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_count").value(1))
                .andExpect(jsonPath("$.maintenance_count").value(1))
                .andExpect(jsonPath("$.active_count").value(0));

        mockMvc.perform(delete("/api/facilities/wash-bays/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(true));

        mockMvc.perform(get("/api/facilities/wash-bays/{id}", id))
                .andExpect(status().isNotFound());

        mockMvc.perform(get("/api/facilities/wash-bays").param("include_deleted", "true"))
                .andExpect(jsonPath("$.wash_bays[0].status").value("inactive"))
                .andExpect(jsonPath("$.wash_bays[0].deleted_at").isNotEmpty());
    }

    @Test
    void deletedBayNumberCanBeReused() throws Exception {
        WashBay old = washBayDao.insert("B5", VehicleSize.STANDARD, List.of(), ResourceStatus.ACTIVE, null);
        washBayDao.softDelete(old.id());

        mockMvc.perform(post("/api/facilities/wash-bays")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"bay_number\": \"B5\", \"max_vehicle_size\": \"compact\"}"))
                .andExpect(status().isCreated());
    }

    @Test
    void compatibleListingUsesRatingsAndBayOrder() {
        washBayDao.insert("B3", VehicleSize.OVERSIZED, List.of("brush"), ResourceStatus.ACTIVE, null);
        washBayDao.insert("B1", VehicleSize.STANDARD, List.of(), ResourceStatus.ACTIVE, null);
        washBayDao.insert("B2", VehicleSize.LARGE, List.of(), ResourceStatus.ACTIVE, null);
        washBayDao.insert("B4", VehicleSize.LARGE, List.of(), ResourceStatus.MAINTENANCE, null);

        List<WashBay> bays = washBayDao.listActiveByRatings(VehicleSize.ratingsAccommodating(VehicleSize.LARGE));

        assertThat(bays).extracting(WashBay::bayNumber).containsExactly("B2", "B3");
        assertThat(bays.get(1).equipmentTypes()).containsExactly("brush");

        Map<ResourceStatus, Long> counts = washBayDao.countByStatus();
        assertThat(counts).containsEntry(ResourceStatus.ACTIVE, 3L)
                .containsEntry(ResourceStatus.MAINTENANCE, 1L)
                .containsEntry(ResourceStatus.INACTIVE, 0L);
    }
}
