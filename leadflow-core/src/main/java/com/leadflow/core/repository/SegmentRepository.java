package com.leadflow.core.repository;

import com.leadflow.core.model.SegmentDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Repository for segment definitions.
 */
public interface SegmentRepository {

    /**
     * Insert or replace a segment definition.
     */
    void save(SegmentDefinition segment);

    Optional<SegmentDefinition> findById(String id);

    /**
     * Active dynamic segments, highest priority first.
     */
    List<SegmentDefinition> findActiveDynamic();

    List<SegmentDefinition> findAll();
}
