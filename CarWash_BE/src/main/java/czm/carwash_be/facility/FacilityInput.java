package czm.carwash_be.facility;

import czm.carwash_be.web.ApiException;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Normalisation and validation of raw request values shared by the facility services.
 */
public final class FacilityInput {

    private FacilityInput() {
    }

    /**
     * Unknown sizes are rejected; there is no fallback to the most restrictive class.
     */
    public static VehicleSize requireVehicleSize(String code) {
        if (code == null || code.isBlank()) {
            throw ApiException.validation("Velikost vozidla je povinná.", "vehicle_size_required");
        }
        return VehicleSize.fromCode(code)
                .orElseThrow(() -> ApiException.validation(
                        "Neznámá velikost vozidla '" + code.trim() + "'. Povolené hodnoty: compact, standard, large, oversized.",
                        "vehicle_size_invalid"));
    }

    public static ResourceStatus parseStatus(String code, Set<ResourceStatus> allowed) {
        if (code == null || code.isBlank()) {
            return null;
        }
        ResourceStatus status = ResourceStatus.fromCode(code)
                .orElseThrow(() -> ApiException.validation("Neznámý stav zdroje '" + code.trim() + "'.", "resource_status_invalid"));
        if (!allowed.contains(status)) {
            throw ApiException.validation("Stav '" + status.code() + "' není pro tento zdroj povolen.", "resource_status_not_allowed");
        }
        return status;
    }

    public static ResourceStatus parseStatus(String code) {
        return parseStatus(code, EnumSet.allOf(ResourceStatus.class));
    }

    public static String requireName(String value, int maxLength, String fieldLabel, String detailCode) {
        if (value == null || value.isBlank()) {
            throw ApiException.validation(fieldLabel + " je povinné.", detailCode + "_required");
        }
        String trimmed = value.trim();
        if (trimmed.length() > maxLength) {
            throw ApiException.validation(fieldLabel + " nesmí přesáhnout " + maxLength + " znaků.", detailCode + "_too_long");
        }
        return trimmed;
    }

    public static List<String> normalizeEquipment(List<String> equipmentTypes) {
        if (equipmentTypes == null) {
            return List.of();
        }
        LinkedHashSet<String> result = new LinkedHashSet<>();
        for (String type : equipmentTypes) {
            if (type == null) {
                continue;
            }
            String trimmed = type.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return List.copyOf(result);
    }

    public static GeoLocation requireLocation(BigDecimal latitude, BigDecimal longitude) {
        if (latitude == null || longitude == null) {
            throw ApiException.validation("Zadejte zeměpisnou šířku i délku.", "location_incomplete");
        }
        if (!GeoLocation.isValidLatitude(latitude)) {
            throw ApiException.validation("Zeměpisná šířka musí být v rozsahu -90 až 90.", "latitude_out_of_range");
        }
        if (!GeoLocation.isValidLongitude(longitude)) {
            throw ApiException.validation("Zeměpisná délka musí být v rozsahu -180 až 180.", "longitude_out_of_range");
        }
        return new GeoLocation(latitude, longitude);
    }

    /**
     * Optional location: both coordinates or neither.
     */
    public static GeoLocation optionalLocation(BigDecimal latitude, BigDecimal longitude) {
        if (latitude == null && longitude == null) {
            return null;
        }
        return requireLocation(latitude, longitude);
    }
}
