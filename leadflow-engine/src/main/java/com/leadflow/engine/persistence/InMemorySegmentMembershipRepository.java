package com.leadflow.engine.persistence;

import com.leadflow.core.model.SegmentMembership;
import com.leadflow.core.repository.SegmentMembershipRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of SegmentMembershipRepository.
 * Closed memberships are kept for history.
 */
@Repository
public class InMemorySegmentMembershipRepository implements SegmentMembershipRepository {
    
    private final Map<UUID, SegmentMembership> memberships = new ConcurrentHashMap<>();
    private final Map<String, UUID> activeIndex = new ConcurrentHashMap<>();
    
    @Override
    public boolean insertIfNotMember(SegmentMembership membership) {
        if (activeIndex.putIfAbsent(key(membership.segmentId(), membership.entityId()), membership.id()) != null) {
            return false;
        }
        memberships.put(membership.id(), membership);
        return true;
    }
    
    @Override
    public boolean close(UUID membershipId, Instant leftAt, String reason) {
        SegmentMembership current = memberships.get(membershipId);
        if (current == null || !current.isActive()) {
            return false;
        }
        if (!activeIndex.remove(key(current.segmentId(), current.entityId()), membershipId)) {
            return false;
        }
        memberships.put(membershipId, current.close(leftAt, reason));
        return true;
    }
    
    @Override
    public Optional<SegmentMembership> findActive(String segmentId, String entityId) {
        UUID id = activeIndex.get(key(segmentId, entityId));
        return id == null ? Optional.empty() : Optional.ofNullable(memberships.get(id)).filter(SegmentMembership::isActive);
    }
    
    @Override
    public List<SegmentMembership> findActiveBySegment(String segmentId) {
        return memberships.values().stream()
            .filter(m -> m.segmentId().equals(segmentId) && m.isActive())
            .sorted(Comparator.comparing(SegmentMembership::joinedAt))
            .collect(Collectors.toList());
    }
    
    @Override
    public List<SegmentMembership> findActiveByEntity(String entityId) {
        return memberships.values().stream()
            .filter(m -> m.entityId().equals(entityId) && m.isActive())
            .sorted(Comparator.comparing(SegmentMembership::joinedAt))
            .collect(Collectors.toList());
    }
    
    @Override
    public List<SegmentMembership> findHistory(String segmentId, String entityId) {
        return memberships.values().stream()
            .filter(m -> m.segmentId().equals(segmentId) && m.entityId().equals(entityId))
            .sorted(Comparator.comparing(SegmentMembership::joinedAt))
            .collect(Collectors.toList());
    }
    
    @Override
    public long countActive(String segmentId) {
        return memberships.values().stream()
            .filter(m -> m.segmentId().equals(segmentId) && m.isActive())
            .count();
    }
    
    private static String key(String segmentId, String entityId) {
        return segmentId + "|" + entityId;
    }
}
