package au.gridlens.domain.common;

/**
 * Rejected input: invalid smoothing or annualisation parameters, cadence mismatches,
 * malformed query keys, unknown entities. Raised before any computation starts.
 */
public class ValidationException extends RuntimeException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
