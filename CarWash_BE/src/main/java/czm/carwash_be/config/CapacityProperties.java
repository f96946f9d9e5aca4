package czm.carwash_be.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Validated
@ConfigurationProperties(prefix = "capacity")
public class CapacityProperties {
    /** Half-width of the window (hours) used to pre-filter bookings around the requested interval. */
    @Positive
    private int searchWindowHours = 24;
    /** Step between enumerated time slots when the caller does not send one. */
    @Positive
    private int defaultSlotIntervalMinutes = 30;
    /** Upper bound of steps for a single slot enumeration; every step queries the bookings of all active bays. */
    @Positive
    private int maxSlotSteps = 2000;
    /** Service radius applied to a new mobile team when none is sent. */
    @Positive
    private BigDecimal defaultTeamRadiusKm = BigDecimal.valueOf(50);
    /** Vehicles per day applied to a new mobile team when none is sent. */
    @Positive
    private int defaultTeamDailyCapacity = 8;

    public int getSearchWindowHours() { return searchWindowHours; }
    public void setSearchWindowHours(int searchWindowHours) { this.searchWindowHours = searchWindowHours; }
    public int getDefaultSlotIntervalMinutes() { return defaultSlotIntervalMinutes; }
    public void setDefaultSlotIntervalMinutes(int defaultSlotIntervalMinutes) { this.defaultSlotIntervalMinutes = defaultSlotIntervalMinutes; }
    public int getMaxSlotSteps() { return maxSlotSteps; }
    public void setMaxSlotSteps(int maxSlotSteps) { this.maxSlotSteps = maxSlotSteps; }
    public BigDecimal getDefaultTeamRadiusKm() { return defaultTeamRadiusKm; }
    public void setDefaultTeamRadiusKm(BigDecimal defaultTeamRadiusKm) { this.defaultTeamRadiusKm = defaultTeamRadiusKm; }
    public int getDefaultTeamDailyCapacity() { return defaultTeamDailyCapacity; }
    public void setDefaultTeamDailyCapacity(int defaultTeamDailyCapacity) { this.defaultTeamDailyCapacity = defaultTeamDailyCapacity; }
}
