package au.gridlens.service.store;

import au.gridlens.domain.common.DataIntegrityViolationException;

import java.util.List;

/**
 * Outcome of one merge call.
 *
 * @param written             net-new records appended
 * @param duplicates          incoming records identical to stored (or repeated) ones, skipped
 * @param violations          entities whose batch was rejected because of a conflicting value
 */
public record MergeResult(int written, int duplicates, List<DataIntegrityViolationException> violations) {

    public static MergeResult empty() {
        return new MergeResult(0, 0, List.of());
    }

    public boolean hasViolations() {
        return !violations.isEmpty();
    }
}
