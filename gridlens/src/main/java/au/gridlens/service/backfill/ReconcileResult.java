package au.gridlens.service.backfill;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Outcome of one reconcile run, days in ascending order.
 *
 * @param filledDays     days that were incomplete and are now complete
 * @param partialDays    days merged from the archive that are still short of expected
 * @param unresolvedDays days that could not be filled, with the reason
 * @param skippedDays    days already complete before the run; not fetched
 * @param recordsWritten net-new records appended
 */
public record ReconcileResult(
        String target,
        List<LocalDate> filledDays,
        List<LocalDate> partialDays,
        Map<LocalDate, String> unresolvedDays,
        List<LocalDate> skippedDays,
        int recordsWritten) {

    public ReconcileResult {
        filledDays = List.copyOf(filledDays);
        partialDays = List.copyOf(partialDays);
        unresolvedDays = Collections.unmodifiableMap(new TreeMap<>(unresolvedDays));
        skippedDays = List.copyOf(skippedDays);
    }

    public boolean isFullyResolved() {
        return unresolvedDays.isEmpty() && partialDays.isEmpty();
    }

    public int daysExamined() {
        return filledDays.size() + partialDays.size() + unresolvedDays.size() + skippedDays.size();
    }

    public String summary() {
        return String.format("%s: %d filled, %d partial, %d unresolved, %d skipped, %d records written",
                target, filledDays.size(), partialDays.size(), unresolvedDays.size(), skippedDays.size(), recordsWritten);
    }
}
