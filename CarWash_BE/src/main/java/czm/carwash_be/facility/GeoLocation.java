package czm.carwash_be.facility;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * WGS-84 coordinate pair.
 */
public record GeoLocation(BigDecimal latitude, BigDecimal longitude) {

    static final double EARTH_RADIUS_KM = 6371.0;

    private static final BigDecimal MAX_LATITUDE = BigDecimal.valueOf(90);
    private static final BigDecimal MAX_LONGITUDE = BigDecimal.valueOf(180);

    public GeoLocation {
        Objects.requireNonNull(latitude, "latitude");
        Objects.requireNonNull(longitude, "longitude");
        if (!isValidLatitude(latitude)) {
            throw new IllegalArgumentException("Zeměpisná šířka musí být v rozsahu -90 až 90.");
        }
        if (!isValidLongitude(longitude)) {
            throw new IllegalArgumentException("Zeměpisná délka musí být v rozsahu -180 až 180.");
        }
    }

    public static boolean isValidLatitude(BigDecimal latitude) {
        return latitude != null && latitude.abs().compareTo(MAX_LATITUDE) <= 0;
    }

    public static boolean isValidLongitude(BigDecimal longitude) {
        return longitude != null && longitude.abs().compareTo(MAX_LONGITUDE) <= 0;
    }

    /**
     * Great-circle distance in kilometres (haversine formula).
     */
    public double distanceKm(GeoLocation other) {
        double lat1 = Math.toRadians(latitude.doubleValue());
        double lat2 = Math.toRadians(other.latitude.doubleValue());
        double deltaLat = Math.toRadians(other.latitude.doubleValue() - latitude.doubleValue());
        double deltaLon = Math.toRadians(other.longitude.doubleValue() - longitude.doubleValue());

        double a = Math.sin(deltaLat / 2) * Math.sin(deltaLat / 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.sin(deltaLon / 2) * Math.sin(deltaLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }
}
