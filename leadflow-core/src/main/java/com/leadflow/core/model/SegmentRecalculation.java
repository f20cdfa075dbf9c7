package com.leadflow.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Result of one recalculation pass over a segment.
 * Entities listed in {@code failures} kept their previous membership.
 */
public record SegmentRecalculation(
    String segmentId,
    List<String> added,
    List<String> removed,
    Map<String, String> failures,
    int evaluated,
    int totalMembers,
    Instant calculatedAt
) {
    public SegmentRecalculation {
        added = List.copyOf(added);
        removed = List.copyOf(removed);
        failures = Map.copyOf(failures);
    }

    public boolean hasChanges() {
        return !added.isEmpty() || !removed.isEmpty();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
