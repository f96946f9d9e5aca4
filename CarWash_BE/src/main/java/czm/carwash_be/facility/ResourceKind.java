package czm.carwash_be.facility;

public enum ResourceKind {
    WASH_BAY,
    MOBILE_TEAM
}
