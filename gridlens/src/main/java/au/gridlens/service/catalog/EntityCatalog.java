package au.gridlens.service.catalog;

import au.gridlens.domain.common.ValidationException;
import au.gridlens.domain.model.EntityDescriptor;
import au.gridlens.domain.model.SourceDescriptor;

import java.util.*;

/**
 * Declared entities and archive sources.
 *
 * An entity's declared native cadence drives its expected daily record count. A source
 * feeds one (domain, cadence) partition.
 */
public final class EntityCatalog {

    private final Map<String, EntityDescriptor> entities;
    private final Map<String, SourceDescriptor> sources;

    public EntityCatalog(Collection<EntityDescriptor> entities, Collection<SourceDescriptor> sources) {
        Map<String, EntityDescriptor> entityMap = new LinkedHashMap<>();
        for (EntityDescriptor entity : entities) {
            if (entityMap.put(entity.entityId(), entity) != null) {
                throw new ValidationException("entityId", "Duplicate entity in catalog: " + entity.entityId());
            }
        }
        Map<String, SourceDescriptor> sourceMap = new LinkedHashMap<>();
        for (SourceDescriptor source : sources) {
            if (sourceMap.put(source.sourceId(), source) != null) {
                throw new ValidationException("sourceId", "Duplicate source in catalog: " + source.sourceId());
            }
            if (entityMap.containsKey(source.sourceId())) {
                throw new ValidationException("sourceId", "Id used by both an entity and a source: " + source.sourceId());
            }
        }
        this.entities = Collections.unmodifiableMap(entityMap);
        this.sources = Collections.unmodifiableMap(sourceMap);
    }

    public Optional<EntityDescriptor> findEntity(String entityId) {
        return Optional.ofNullable(entities.get(entityId));
    }

    public Optional<SourceDescriptor> findSource(String sourceId) {
        return Optional.ofNullable(sources.get(sourceId));
    }

    public EntityDescriptor requireEntity(String entityId) {
        EntityDescriptor entity = entities.get(entityId);
        if (entity == null) {
            throw new ValidationException("entityId", "Unknown entity: " + entityId);
        }
        return entity;
    }

    public SourceDescriptor requireSource(String sourceId) {
        SourceDescriptor source = sources.get(sourceId);
        if (source == null) {
            throw new ValidationException("sourceId", "Unknown source: " + sourceId);
        }
        return source;
    }

    public boolean isSource(String id) {
        return sources.containsKey(id);
    }

    /**
     * Archive source publishing an entity's declared (domain, cadence).
     */
    public SourceDescriptor sourceFor(EntityDescriptor entity) {
        return sources.values().stream()
                .filter(s -> s.domain() == entity.domain() && s.cadence() == entity.nativeCadence())
                .findFirst()
                .orElseThrow(() -> new ValidationException("sourceId", String.format(
                        "No archive source for %s (%s @ %s)",
                        entity.entityId(), entity.domain(), entity.nativeCadence().getLabel())));
    }

    public Collection<EntityDescriptor> entities() {
        return entities.values();
    }

    public Collection<SourceDescriptor> sources() {
        return sources.values();
    }

    public List<EntityDescriptor> entitiesInRegion(String region) {
        return entities.values().stream()
                .filter(e -> region.equalsIgnoreCase(e.region()))
                .toList();
    }
}
