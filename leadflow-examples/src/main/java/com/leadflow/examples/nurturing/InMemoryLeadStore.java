package com.leadflow.examples.nurturing;

import com.leadflow.core.exception.NotFoundException;
import com.leadflow.core.model.EntitySnapshot;
import com.leadflow.core.port.EntityPopulation;
import com.leadflow.core.port.EntitySnapshotProvider;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Lead records kept in memory, keyed by lead id.
 *
 * Serves as the entity source for the engine in the demo and in tests. Each
 * update works on a copy, so snapshots taken earlier never change.
 */
public class InMemoryLeadStore implements EntitySnapshotProvider, EntityPopulation {

    private final Map<String, Map<String, Object>> leads = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryLeadStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * Create or replace a lead. {@code created_at} defaults to now.
     */
    public void save(String leadId, Map<String, Object> attributes) {
        Map<String, Object> copy = new HashMap<>(attributes);
        copy.putIfAbsent(LeadSchema.CREATED_AT, clock.instant());
        leads.put(leadId, copy);
    }

    /**
     * Apply a change to a lead and stamp {@code updated_at}.
     *
     * @return the attributes after the change
     * @throws NotFoundException if the lead does not exist
     */
    public Map<String, Object> update(String leadId, Consumer<Map<String, Object>> change) {
        Map<String, Object> updated = leads.computeIfPresent(leadId, (id, current) -> {
            Map<String, Object> copy = new HashMap<>(current);
            change.accept(copy);
            copy.put(LeadSchema.UPDATED_AT, clock.instant());
            return copy;
        });
        if (updated == null) {
            throw new NotFoundException("Lead", leadId);
        }
        return Map.copyOf(withoutNulls(updated));
    }

    public Optional<Map<String, Object>> find(String leadId) {
        return Optional.ofNullable(leads.get(leadId)).map(HashMap::new);
    }

    public Object attribute(String leadId, String field) {
        Map<String, Object> lead = leads.get(leadId);
        return lead == null ? null : lead.get(field);
    }

    public boolean exists(String leadId) {
        return leads.containsKey(leadId);
    }

    /**
     * Append a timestamp to an event collection such as {@code email_opens}
     * and count it as activity.
     */
    public void recordEvent(String leadId, String collectionField) {
        Instant now = clock.instant();
        update(leadId, lead -> {
            List<Object> events = new ArrayList<>();
            if (lead.get(collectionField) instanceof Collection<?> existing) {
                events.addAll(existing);
            }
            events.add(now);
            lead.put(collectionField, events);
            lead.put(LeadSchema.LAST_ACTIVITY_AT, now);
        });
    }

    @Override
    public Optional<EntitySnapshot> getSnapshot(String entityId) {
        Map<String, Object> lead = leads.get(entityId);
        return lead == null ? Optional.empty() : Optional.of(EntitySnapshot.of(entityId, lead));
    }

    @Override
    public List<String> entityIds() {
        return leads.keySet().stream().sorted().toList();
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> attributes) {
        Map<String, Object> result = new HashMap<>();
        attributes.forEach((key, value) -> {
            if (value != null) {
                result.put(key, value);
            }
        });
        return result;
    }
}
