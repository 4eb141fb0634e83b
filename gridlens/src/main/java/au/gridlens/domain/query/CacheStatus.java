package au.gridlens.domain.query;

public enum CacheStatus {
    HIT,
    MISS,
    IN_FLIGHT_JOINED
}
