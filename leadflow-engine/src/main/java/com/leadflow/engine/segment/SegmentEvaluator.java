package com.leadflow.engine.segment;

import com.leadflow.core.exception.NotFoundException;
import com.leadflow.core.exception.RuleValidationException;
import com.leadflow.core.exception.SegmentMutationException;
import com.leadflow.core.model.EntitySnapshot;
import com.leadflow.core.model.SegmentDefinition;
import com.leadflow.core.model.SegmentMembership;
import com.leadflow.core.model.SegmentRecalculation;
import com.leadflow.core.port.EntityPopulation;
import com.leadflow.core.port.EntitySnapshotProvider;
import com.leadflow.core.repository.SegmentMembershipRepository;
import com.leadflow.core.repository.SegmentRepository;
import com.leadflow.core.rule.RuleEvaluation;
import com.leadflow.core.rule.RuleEvaluator;
import com.leadflow.core.rule.RuleValidator;
import com.leadflow.engine.cache.DefinitionCache;
import com.leadflow.engine.logging.LoggingContext;
import com.leadflow.engine.metrics.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Classifies entities into segments with the same rule language workflows
 * use for entry.
 *
 * Dynamic segment membership is only written here, by recalculation. Each
 * segment has a single writer at a time; different segments are recalculated
 * concurrently. An entity that cannot be evaluated keeps its membership and is
 * reported in the result.
 */
public class SegmentEvaluator {

    private static final Logger log = LoggerFactory.getLogger(SegmentEvaluator.class);

    public static final String REASON_ENTITY_GONE = "entity_not_in_population";

    private final SegmentRepository segmentRepository;
    private final SegmentMembershipRepository membershipRepository;
    private final DefinitionCache definitionCache;
    private final EntitySnapshotProvider snapshotProvider;
    private final EntityPopulation population;
    private final RuleEvaluator ruleEvaluator;
    private final RuleValidator ruleValidator;
    private final WorkflowMetrics metrics;
    private final Clock clock;

    private final Map<String, ReentrantLock> segmentLocks = new ConcurrentHashMap<>();

    public SegmentEvaluator(
            SegmentRepository segmentRepository,
            SegmentMembershipRepository membershipRepository,
            DefinitionCache definitionCache,
            EntitySnapshotProvider snapshotProvider,
            EntityPopulation population,
            RuleEvaluator ruleEvaluator,
            RuleValidator ruleValidator,
            WorkflowMetrics metrics,
            Clock clock) {
        this.segmentRepository = segmentRepository;
        this.membershipRepository = membershipRepository;
        this.definitionCache = definitionCache;
        this.snapshotProvider = snapshotProvider;
        this.population = population;
        this.ruleEvaluator = ruleEvaluator;
        this.ruleValidator = ruleValidator;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ========== Definitions ==========

    /**
     * Create or replace a segment definition.
     *
     * @throws RuleValidationException if a rule is invalid
     * @throws SegmentMutationException if a dynamic segment has no rules
     */
    public SegmentDefinition define(SegmentDefinition segment) {
        if (segment.dynamic()) {
            if (segment.rules().isEmpty()) {
                throw new SegmentMutationException(segment.id(), "dynamic segments need at least one rule");
            }
            ruleValidator.validate(segment.rules());
        }

        SegmentDefinition stored = segment.createdAt() == null ? segment.withCreatedAt(clock.instant()) : segment;
        segmentRepository.save(stored);
        definitionCache.invalidateSegment(stored.id());

        log.info("Defined {} segment {} ({} rules)",
            stored.dynamic() ? "dynamic" : "static", stored.id(), stored.rules().size());
        return stored;
    }

    public SegmentDefinition getSegment(String segmentId) {
        return definitionCache.segment(segmentId)
            .orElseThrow(() -> new NotFoundException("Segment", segmentId));
    }

    // ========== Recalculation ==========

    /**
     * Re-evaluate a dynamic segment over the whole entity population and
     * apply the difference to its membership.
     *
     * @throws SegmentMutationException if the segment is static
     */
    public SegmentRecalculation recalculate(String segmentId) {
        SegmentDefinition segment = getSegment(segmentId);
        if (!segment.dynamic()) {
            throw new SegmentMutationException(segmentId, "static segments are not recalculated");
        }

        try (var ctx = LoggingContext.forSegment(segmentId)) {
            return withSegmentLock(segmentId, () -> recalculateLocked(segment));
        }
    }

    /**
     * Recalculate every active dynamic segment, highest priority first. A
     * segment that fails is logged and left out of the result.
     */
    public List<SegmentRecalculation> recalculateAll() {
        List<SegmentRecalculation> results = new ArrayList<>();
        for (SegmentDefinition segment : segmentRepository.findActiveDynamic()) {
            try {
                results.add(recalculate(segment.id()));
            } catch (RuntimeException e) {
                log.error("Recalculation of segment {} failed", segment.id(), e);
            }
        }
        log.info("Recalculated {} segments", results.size());
        return results;
    }

    /**
     * Re-evaluate one entity against every active dynamic segment.
     *
     * @throws NotFoundException if the entity does not exist
     */
    public EntityReevaluation reevaluateEntity(String entityId) {
        try (var ctx = LoggingContext.forEntity(entityId)) {
            EntitySnapshot snapshot = snapshotProvider.getSnapshot(entityId)
                .orElseThrow(() -> new NotFoundException("Entity", entityId));
            Instant now = clock.instant();

            List<String> joined = new ArrayList<>();
            List<String> left = new ArrayList<>();
            Map<String, String> failures = new LinkedHashMap<>();

            for (SegmentDefinition segment : segmentRepository.findActiveDynamic()) {
                RuleEvaluation evaluation = ruleEvaluator.evaluateDetailed(snapshot, segment.rules(), now);
                if (evaluation.isError()) {
                    failures.put(segment.id(), String.valueOf(evaluation.error()));
                    metrics.ruleEvaluationError("segment");
                    continue;
                }
                withSegmentLock(segment.id(), () -> {
                    Optional<SegmentMembership> membership = membershipRepository.findActive(segment.id(), entityId);
                    if (evaluation.isMatched() && membership.isEmpty() && join(segment.id(), entityId, now)) {
                        joined.add(segment.id());
                    } else if (!evaluation.isMatched() && membership.isPresent()
                            && leave(membership.get(), now, SegmentMembership.REASON_RULES_NO_LONGER_MATCH)) {
                        left.add(segment.id());
                    }
                    return null;
                });
            }

            if (!joined.isEmpty() || !left.isEmpty()) {
                log.info("Entity {} joined {} and left {}", entityId, joined, left);
            }
            return new EntityReevaluation(entityId, joined, left, failures);
        }
    }

    // ========== Membership ==========

    /**
     * Segment ids the entity currently belongs to.
     */
    public List<String> segmentsOf(String entityId) {
        return membershipRepository.findActiveByEntity(entityId).stream()
            .map(SegmentMembership::segmentId)
            .collect(Collectors.toList());
    }

    public List<SegmentMembership> members(String segmentId) {
        return membershipRepository.findActiveBySegment(segmentId);
    }

    /**
     * Every membership span of an entity in a segment, oldest first.
     */
    public List<SegmentMembership> history(String segmentId, String entityId) {
        return membershipRepository.findHistory(segmentId, entityId);
    }

    /**
     * Add an entity to a static segment.
     *
     * @return false if the entity already was a member
     * @throws SegmentMutationException if the segment is dynamic
     */
    public boolean addManually(String segmentId, String entityId, String addedBy) {
        requireStatic(segmentId);
        return withSegmentLock(segmentId, () -> membershipRepository.insertIfNotMember(
            SegmentMembership.join(segmentId, entityId, clock.instant(), addedBy, SegmentMembership.REASON_MANUAL)));
    }

    /**
     * Remove an entity from a static segment.
     *
     * @return false if the entity was not a member
     * @throws SegmentMutationException if the segment is dynamic
     */
    public boolean removeManually(String segmentId, String entityId, String reason) {
        requireStatic(segmentId);
        return withSegmentLock(segmentId, () -> membershipRepository.findActive(segmentId, entityId)
            .map(m -> membershipRepository.close(m.id(), clock.instant(), reason == null ? SegmentMembership.REASON_MANUAL : reason))
            .orElse(false));
    }

    // ========== Internal Methods ==========

    private SegmentRecalculation recalculateLocked(SegmentDefinition segment) {
        Instant now = clock.instant();
        Map<String, SegmentMembership> current = membershipRepository.findActiveBySegment(segment.id()).stream()
            .collect(Collectors.toMap(SegmentMembership::entityId, Function.identity(), (a, b) -> a));
        Set<String> entityIds = new LinkedHashSet<>(population.entityIds());

        List<String> added = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();

        for (String entityId : entityIds) {
            try {
                Optional<Boolean> matches = matches(segment, entityId, now, failures);
                if (matches.isEmpty()) {
                    continue;
                }
                SegmentMembership membership = current.get(entityId);
                if (matches.get() && membership == null && join(segment.id(), entityId, now)) {
                    added.add(entityId);
                } else if (!matches.get() && membership != null
                        && leave(membership, now, SegmentMembership.REASON_RULES_NO_LONGER_MATCH)) {
                    removed.add(entityId);
                }
            } catch (RuntimeException e) {
                log.warn("Could not evaluate entity {} for segment {}", entityId, segment.id(), e);
                failures.put(entityId, e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }

        for (SegmentMembership membership : current.values()) {
            if (!entityIds.contains(membership.entityId()) && leave(membership, now, REASON_ENTITY_GONE)) {
                removed.add(membership.entityId());
            }
        }

        int totalMembers = (int) membershipRepository.countActive(segment.id());
        metrics.segmentRecalculated(segment.id(), added.size(), removed.size(), failures.size());
        if (!failures.isEmpty()) {
            log.warn("Segment {}: {} entities could not be evaluated", segment.id(), failures.size());
        }
        log.info("Recalculated segment {}: {} added, {} removed, {} members",
            segment.id(), added.size(), removed.size(), totalMembers);

        return new SegmentRecalculation(segment.id(), added, removed, failures,
            entityIds.size(), totalMembers, now);
    }

    /**
     * @return whether the entity matches, or empty if it could not be evaluated
     */
    private Optional<Boolean> matches(SegmentDefinition segment, String entityId, Instant now,
                                      Map<String, String> failures) {
        Optional<EntitySnapshot> snapshot = snapshotProvider.getSnapshot(entityId);
        if (snapshot.isEmpty()) {
            failures.put(entityId, "entity not found");
            return Optional.empty();
        }
        RuleEvaluation evaluation = ruleEvaluator.evaluateDetailed(snapshot.get(), segment.rules(), now);
        if (evaluation.isError()) {
            failures.put(entityId, String.valueOf(evaluation.error()));
            metrics.ruleEvaluationError("segment");
            return Optional.empty();
        }
        return Optional.of(evaluation.isMatched());
    }

    private boolean join(String segmentId, String entityId, Instant now) {
        return membershipRepository.insertIfNotMember(SegmentMembership.join(
            segmentId, entityId, now, SegmentMembership.ADDED_BY_SYSTEM, SegmentMembership.REASON_AUTOMATIC));
    }

    private boolean leave(SegmentMembership membership, Instant now, String reason) {
        return membershipRepository.close(membership.id(), now, reason);
    }

    private void requireStatic(String segmentId) {
        SegmentDefinition segment = getSegment(segmentId);
        if (segment.dynamic()) {
            throw new SegmentMutationException(segmentId, "membership of dynamic segments is managed by recalculation");
        }
    }

    private <T> T withSegmentLock(String segmentId, Supplier<T> work) {
        ReentrantLock lock = segmentLocks.computeIfAbsent(segmentId, id -> new ReentrantLock());
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Segment changes for one entity.
     */
    public record EntityReevaluation(
        String entityId,
        List<String> joined,
        List<String> left,
        Map<String, String> failures
    ) {
        public EntityReevaluation {
            joined = List.copyOf(joined);
            left = List.copyOf(left);
            failures = Map.copyOf(failures);
        }
    }
}
