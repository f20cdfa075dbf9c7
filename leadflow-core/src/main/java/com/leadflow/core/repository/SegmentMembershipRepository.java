package com.leadflow.core.repository;

import com.leadflow.core.model.SegmentMembership;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for segment membership spans.
 * Memberships are closed, never deleted.
 */
public interface SegmentMembershipRepository {

    /**
     * Insert a membership unless the entity is already an active member.
     *
     * @return true if inserted
     */
    boolean insertIfNotMember(SegmentMembership membership);

    /**
     * Close an active membership.
     *
     * @return true if the membership was active and is now closed
     */
    boolean close(UUID membershipId, Instant leftAt, String reason);

    Optional<SegmentMembership> findActive(String segmentId, String entityId);

    List<SegmentMembership> findActiveBySegment(String segmentId);

    List<SegmentMembership> findActiveByEntity(String entityId);

    /**
     * Every membership span of an entity in a segment, oldest first.
     */
    List<SegmentMembership> findHistory(String segmentId, String entityId);

    long countActive(String segmentId);
}
