package au.gridlens.domain.query;

import au.gridlens.domain.common.ValidationException;
import au.gridlens.domain.model.Cadence;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Every parameter that determines a cached pipeline result.
 *
 * The entity set is normalized (sorted, de-duplicated) so equal requests produce equal keys.
 */
public record QueryKey(
        List<String> entities,
        Instant start,
        Instant end,
        Cadence targetCadence,
        SmoothingConfig smoothing,
        AnnualisationConfig annualisation) {

    public QueryKey {
        if (entities == null || entities.isEmpty()) {
            throw new ValidationException("entities", "Query must name at least one entity");
        }
        TreeSet<String> normalized = new TreeSet<>();
        for (String entity : entities) {
            if (entity == null || entity.isBlank()) {
                throw new ValidationException("entities", "Entity ids must not be blank");
            }
            normalized.add(entity.trim());
        }
        entities = List.copyOf(normalized);
        if (start == null || end == null) {
            throw new ValidationException("range", "Query start and end are required");
        }
        if (!start.isBefore(end)) {
            throw new ValidationException("range", String.format("Query start %s must be before end %s", start, end));
        }
        if (targetCadence == null) {
            throw new ValidationException("targetCadence", "Target cadence is required");
        }
        if (smoothing == null) {
            throw new ValidationException("smoothing", "Smoothing configuration is required");
        }
        if (annualisation == null) {
            throw new ValidationException("annualisation", "Annualisation configuration is required");
        }
    }

    /**
     * True when data for any of the given entities landing in [from, to) could change this key's result.
     */
    public boolean overlaps(Collection<String> entityIds, Instant from, Instant to) {
        if (!from.isBefore(end) || !to.isAfter(start)) {
            return false;
        }
        Set<String> mine = Set.copyOf(entities);
        for (String id : entityIds) {
            if (mine.contains(id)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Same key over [start, end). Used to widen a key to the first bucket its output covers.
     */
    public QueryKey withStart(Instant newStart) {
        return new QueryKey(entities, newStart, end, targetCadence, smoothing, annualisation);
    }

    public String label() {
        return entities.size() == 1 ? entities.get(0) : String.join("+", entities);
    }
}
