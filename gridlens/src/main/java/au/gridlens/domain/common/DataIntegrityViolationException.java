package au.gridlens.domain.common;

import au.gridlens.domain.model.RecordKey;

/**
 * A merge would have stored two different values under the same record key.
 *
 * Not resolved automatically: the entity's write path stays blocked until an operator
 * releases it.
 */
public class DataIntegrityViolationException extends RuntimeException {

    private final String entityId;
    private final RecordKey key;
    private final double existingValue;
    private final double incomingValue;

    public DataIntegrityViolationException(RecordKey key, double existingValue, double incomingValue) {
        super(String.format("[%s] Conflicting values for %s @ %s (%s): stored %s, incoming %s",
                key.entityId(), key.entityId(), key.timestamp(), key.nativeCadence().getLabel(),
                existingValue, incomingValue));
        this.entityId = key.entityId();
        this.key = key;
        this.existingValue = existingValue;
        this.incomingValue = incomingValue;
    }

    public DataIntegrityViolationException(String entityId, String message) {
        super(String.format("[%s] %s", entityId, message));
        this.entityId = entityId;
        this.key = null;
        this.existingValue = Double.NaN;
        this.incomingValue = Double.NaN;
    }

    public String getEntityId() {
        return entityId;
    }

    /**
     * Conflicting key, or null when the entity was already quarantined.
     */
    public RecordKey getKey() {
        return key;
    }

    public double getExistingValue() {
        return existingValue;
    }

    public double getIncomingValue() {
        return incomingValue;
    }
}
