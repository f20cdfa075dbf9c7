package com.leadflow.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * An entity's membership of a segment over one time span.
 * Closed by setting {@code leftAt}; rows are never deleted, so the history of
 * joins and leaves stays available for audit.
 */
public record SegmentMembership(
    UUID id,
    String segmentId,
    String entityId,
    Instant joinedAt,
    String addedBy,
    String reason,
    Instant leftAt,
    String leftReason
) {
    public static final String ADDED_BY_SYSTEM = "system";
    public static final String REASON_AUTOMATIC = "automatic_segmentation";
    public static final String REASON_RULES_NO_LONGER_MATCH = "rules_no_longer_match";
    public static final String REASON_MANUAL = "manual";

    public static SegmentMembership join(String segmentId, String entityId, Instant at, String addedBy, String reason) {
        return new SegmentMembership(UUID.randomUUID(), segmentId, entityId, at, addedBy, reason, null, null);
    }

    public boolean isActive() {
        return leftAt == null;
    }

    /**
     * Copy closed at the given time.
     */
    public SegmentMembership close(Instant at, String why) {
        return new SegmentMembership(id, segmentId, entityId, joinedAt, addedBy, reason, at, why);
    }
}
