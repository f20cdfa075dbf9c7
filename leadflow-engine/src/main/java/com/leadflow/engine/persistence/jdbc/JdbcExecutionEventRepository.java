package com.leadflow.engine.persistence.jdbc;

import com.leadflow.core.model.ExecutionEvent;
import com.leadflow.core.model.ExecutionEventType;
import com.leadflow.core.repository.ExecutionEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of ExecutionEventRepository.
 * Append-only; the unique idempotency key drops duplicate appends.
 */
@Repository("jdbcExecutionEventRepository")
public class JdbcExecutionEventRepository implements ExecutionEventRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcExecutionEventRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final DefinitionJsonCodec codec;
    private final RowMapper<ExecutionEvent> rowMapper;

    public JdbcExecutionEventRepository(JdbcTemplate jdbcTemplate, DefinitionJsonCodec codec) {
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
        this.rowMapper = this::mapRow;
    }

    @Override
    public boolean append(ExecutionEvent event) {
        String sql = """
            INSERT INTO execution_events (
                event_id, execution_id, sequence_number, type, step_index,
                timestamp, payload, idempotency_key, actor_type, actor_id
            ) VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?)
            ON CONFLICT (idempotency_key) DO NOTHING
            """;

        int rows = jdbcTemplate.update(sql,
            event.eventId(),
            event.executionId(),
            event.sequenceNumber(),
            event.type().name(),
            event.stepIndex(),
            Timestamp.from(event.timestamp()),
            codec.write(event.payload()),
            event.idempotencyKey(),
            event.actorType(),
            event.actorId()
        );

        if (rows > 0) {
            log.debug("Appended event {} (seq={}) for execution {}",
                event.type(), event.sequenceNumber(), event.executionId());
        } else {
            log.debug("Event with idempotency key {} already exists, skipped", event.idempotencyKey());
        }
        return rows > 0;
    }

    @Override
    public List<ExecutionEvent> findByExecution(UUID executionId) {
        return jdbcTemplate.query(
            "SELECT * FROM execution_events WHERE execution_id = ? ORDER BY sequence_number, timestamp",
            rowMapper, executionId);
    }

    @Override
    public Optional<ExecutionEvent> findByIdempotencyKey(String idempotencyKey) {
        List<ExecutionEvent> results = jdbcTemplate.query(
            "SELECT * FROM execution_events WHERE idempotency_key = ?", rowMapper, idempotencyKey);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public long getNextSequenceNumber(UUID executionId) {
        Long max = jdbcTemplate.queryForObject(
            "SELECT MAX(sequence_number) FROM execution_events WHERE execution_id = ?", Long.class, executionId);
        return max == null ? 1 : max + 1;
    }

    private ExecutionEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
        Integer stepIndex = rs.getObject("step_index", Integer.class);
        return new ExecutionEvent(
            rs.getObject("event_id", UUID.class),
            rs.getObject("execution_id", UUID.class),
            rs.getLong("sequence_number"),
            ExecutionEventType.valueOf(rs.getString("type")),
            stepIndex,
            rs.getTimestamp("timestamp").toInstant(),
            codec.read(rs.getString("payload")),
            rs.getString("idempotency_key"),
            rs.getString("actor_type"),
            rs.getString("actor_id")
        );
    }
}
