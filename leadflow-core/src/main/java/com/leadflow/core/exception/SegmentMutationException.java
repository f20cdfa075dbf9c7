package com.leadflow.core.exception;

/**
 * Thrown when membership of a dynamic segment is edited by hand.
 * Dynamic membership is only ever written by recalculation.
 */
public class SegmentMutationException extends LeadflowException {
    
    public static final String ERROR_CODE = "SEGMENT_MUTATION_REJECTED";
    
    public SegmentMutationException(String segmentId, String reason) {
        super(ERROR_CODE, String.format(
            "Cannot modify membership of segment %s: %s",
            segmentId, reason
        ));
    }
}
