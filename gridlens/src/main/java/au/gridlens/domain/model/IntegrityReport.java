package au.gridlens.domain.model;

import java.time.LocalDate;

/**
 * Record count audit of one entity or source for one market day.
 */
public record IntegrityReport(
        String target,
        AuditTargetKind targetKind,
        LocalDate day,
        Cadence cadence,
        int expectedCount,
        int actualCount,
        CoverageStatus status) {

    public static IntegrityReport of(String target, AuditTargetKind kind, LocalDate day, Cadence cadence, int actualCount) {
        int expected = cadence.periodsPerDay();
        return new IntegrityReport(target, kind, day, cadence, expected, actualCount,
                CoverageStatus.classify(actualCount, expected));
    }

    public boolean isComplete() {
        return status == CoverageStatus.COMPLETE;
    }

    public double ratio() {
        return (double) actualCount / expectedCount;
    }
}
