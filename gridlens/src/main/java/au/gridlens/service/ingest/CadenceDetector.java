package au.gridlens.service.ingest;

import au.gridlens.domain.common.ValidationException;
import au.gridlens.domain.model.Cadence;

import java.time.Instant;
import java.util.*;

/**
 * Infers the cadence of a sample stream from its timestamps.
 *
 * Uses the most frequent gap between consecutive distinct timestamps, rounded to whole
 * minutes, so occasional missing intervals do not change the answer. Ties go to the
 * shorter gap.
 */
public final class CadenceDetector {

    public Cadence detect(Collection<Instant> timestamps) {
        if (timestamps == null) {
            throw new ValidationException("timestamps", "Timestamps must not be null");
        }
        TreeSet<Instant> sorted = new TreeSet<>(timestamps);
        if (sorted.size() < 2) {
            throw new ValidationException("timestamps",
                    "At least two distinct timestamps are needed to detect a cadence, got " + sorted.size());
        }

        Map<Long, Integer> gapCounts = new TreeMap<>();
        Instant previous = null;
        for (Instant ts : sorted) {
            if (previous != null) {
                long minutes = Math.round((ts.getEpochSecond() - previous.getEpochSecond()) / 60.0);
                gapCounts.merge(minutes, 1, Integer::sum);
            }
            previous = ts;
        }

        long modal = gapCounts.entrySet().stream()
                .max(Comparator.comparingInt((Map.Entry<Long, Integer> e) -> e.getValue())
                        .thenComparing(Map.Entry::getKey, Comparator.reverseOrder()))
                .map(Map.Entry::getKey)
                .orElseThrow();
        if (modal <= 0 || modal > Cadence.MINUTES_PER_DAY) {
            throw new ValidationException("timestamps", "No supported cadence for a modal gap of " + modal + " minutes");
        }
        return Cadence.ofMinutes((int) modal);
    }
}
