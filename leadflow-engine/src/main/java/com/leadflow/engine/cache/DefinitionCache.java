package com.leadflow.engine.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.leadflow.core.model.SegmentDefinition;
import com.leadflow.core.model.WorkflowDefinition;
import com.leadflow.core.repository.SegmentRepository;
import com.leadflow.core.repository.WorkflowDefinitionRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Read-through cache of workflow and segment definitions.
 *
 * Entries expire after a fixed time and are invalidated explicitly when a
 * definition is published, deactivated or redefined. Entity data is never
 * cached here.
 */
public class DefinitionCache {

    private static final Logger log = LoggerFactory.getLogger(DefinitionCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
    public static final long DEFAULT_MAX_SIZE = 1_000;

    private final WorkflowDefinitionRepository definitionRepository;
    private final SegmentRepository segmentRepository;

    private final Cache<String, List<WorkflowDefinition>> activeByTriggerKind;
    private final Cache<String, WorkflowDefinition> definitionsById;
    private final Cache<String, SegmentDefinition> segmentsById;

    public DefinitionCache(WorkflowDefinitionRepository definitionRepository, SegmentRepository segmentRepository) {
        this(definitionRepository, segmentRepository, DEFAULT_TTL, DEFAULT_MAX_SIZE);
    }

    public DefinitionCache(
            WorkflowDefinitionRepository definitionRepository,
            SegmentRepository segmentRepository,
            Duration ttl,
            long maxSize) {
        this.definitionRepository = definitionRepository;
        this.segmentRepository = segmentRepository;
        this.activeByTriggerKind = newCache(ttl, maxSize);
        this.definitionsById = newCache(ttl, maxSize);
        this.segmentsById = newCache(ttl, maxSize);
    }

    /**
     * Active workflow definitions listening to a trigger kind.
     */
    public List<WorkflowDefinition> activeByTriggerKind(String triggerKind) {
        return activeByTriggerKind.get(triggerKind,
            kind -> List.copyOf(definitionRepository.findActiveByTriggerKind(kind)));
    }

    /**
     * A published workflow version by id, active or not.
     */
    public Optional<WorkflowDefinition> definition(String id) {
        return Optional.ofNullable(definitionsById.get(id,
            key -> definitionRepository.findById(key).orElse(null)));
    }

    public Optional<SegmentDefinition> segment(String id) {
        return Optional.ofNullable(segmentsById.get(id,
            key -> segmentRepository.findById(key).orElse(null)));
    }

    /**
     * Drop cached workflow definitions after a publish or an activation change.
     */
    public void invalidateDefinitions() {
        activeByTriggerKind.invalidateAll();
        definitionsById.invalidateAll();
        log.debug("Invalidated workflow definition cache");
    }

    public void invalidateSegment(String segmentId) {
        segmentsById.invalidate(segmentId);
        log.debug("Invalidated cached segment {}", segmentId);
    }

    /**
     * Export hit and miss statistics.
     */
    public void bindMetrics(MeterRegistry registry) {
        new CaffeineCacheMetrics<>(activeByTriggerKind, "leadflow.definitions.by-trigger", Tags.empty()).bindTo(registry);
        new CaffeineCacheMetrics<>(definitionsById, "leadflow.definitions.by-id", Tags.empty()).bindTo(registry);
        new CaffeineCacheMetrics<>(segmentsById, "leadflow.segments.by-id", Tags.empty()).bindTo(registry);
    }

    long estimatedSize() {
        return activeByTriggerKind.estimatedSize() + definitionsById.estimatedSize() + segmentsById.estimatedSize();
    }

    private static <V> Cache<String, V> newCache(Duration ttl, long maxSize) {
        return Caffeine.newBuilder()
            .expireAfterWrite(ttl)
            .maximumSize(maxSize)
            .recordStats()
            .build();
    }
}
