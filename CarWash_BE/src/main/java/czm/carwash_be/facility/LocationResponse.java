package czm.carwash_be.facility;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record LocationResponse(
        @JsonProperty("latitude") BigDecimal latitude,
        @JsonProperty("longitude") BigDecimal longitude) {

    static LocationResponse of(GeoLocation location) {
        return location == null ? null : new LocationResponse(location.latitude(), location.longitude());
    }
}
