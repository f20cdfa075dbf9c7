package com.leadflow.engine.persistence;

import com.leadflow.core.model.SegmentDefinition;
import com.leadflow.core.repository.SegmentRepository;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of SegmentRepository.
 */
@Repository
public class InMemorySegmentRepository implements SegmentRepository {
    
    private final Map<String, SegmentDefinition> segments = new ConcurrentHashMap<>();
    
    @Override
    public void save(SegmentDefinition segment) {
        segments.put(segment.id(), segment);
    }
    
    @Override
    public Optional<SegmentDefinition> findById(String id) {
        return Optional.ofNullable(segments.get(id));
    }
    
    @Override
    public List<SegmentDefinition> findActiveDynamic() {
        return segments.values().stream()
            .filter(s -> s.active() && s.dynamic())
            .sorted(Comparator.comparingInt(SegmentDefinition::priority).reversed()
                .thenComparing(SegmentDefinition::id))
            .collect(Collectors.toList());
    }
    
    @Override
    public List<SegmentDefinition> findAll() {
        return segments.values().stream()
            .sorted(Comparator.comparing(SegmentDefinition::id))
            .collect(Collectors.toList());
    }
}
