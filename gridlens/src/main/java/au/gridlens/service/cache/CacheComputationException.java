package au.gridlens.service.cache;

import au.gridlens.domain.query.QueryKey;

/**
 * A cached computation failed. Every caller waiting on the same key receives this exception.
 */
public class CacheComputationException extends RuntimeException {

    private final QueryKey key;

    public CacheComputationException(QueryKey key, String message, Throwable cause) {
        super(String.format("[%s] %s", key.label(), message), cause);
        this.key = key;
    }

    public QueryKey getKey() {
        return key;
    }
}
