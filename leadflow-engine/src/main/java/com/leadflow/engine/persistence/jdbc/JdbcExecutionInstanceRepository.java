package com.leadflow.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.leadflow.core.exception.OptimisticLockException;
import com.leadflow.core.model.ExecutionInstance;
import com.leadflow.core.model.ExecutionStatus;
import com.leadflow.core.model.WakeAction;
import com.leadflow.core.repository.ExecutionInstanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of ExecutionInstanceRepository.
 *
 * A partial unique index on (workflow_id, entity_id) over active statuses makes
 * the conditional insert atomic. Updates are compare-and-set on the version column.
 */
@Repository("jdbcExecutionInstanceRepository")
public class JdbcExecutionInstanceRepository implements ExecutionInstanceRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcExecutionInstanceRepository.class);

    private static final String ACTIVE_STATUSES = "('RUNNING', 'WAITING', 'PAUSED')";

    private final JdbcTemplate jdbcTemplate;
    private final DefinitionJsonCodec codec;
    private final RowMapper<ExecutionInstance> rowMapper;

    public JdbcExecutionInstanceRepository(JdbcTemplate jdbcTemplate, DefinitionJsonCodec codec) {
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
        this.rowMapper = this::mapRow;
    }

    @Override
    public boolean insertIfNoActive(ExecutionInstance instance) {
        if (!instance.isActive()) {
            throw new IllegalArgumentException("Only active executions can be inserted");
        }

        String sql = """
            INSERT INTO execution_instances (
                id, workflow_id, entity_id, trigger_kind, trigger_payload,
                status, current_step_index, context, retry_count_for_current_step,
                pending_wake, step_history, error, error_code,
                created_at, updated_at, next_wake_at, completed_at, version
            ) VALUES (?, ?, ?, ?, ?::jsonb, ?, ?, ?::jsonb, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT DO NOTHING
            """;

        int rows = jdbcTemplate.update(sql,
            instance.id(),
            instance.workflowId(),
            instance.entityId(),
            instance.triggerKind(),
            codec.write(instance.triggerPayload()),
            instance.status().name(),
            instance.currentStepIndex(),
            codec.write(instance.context()),
            instance.retryCountForCurrentStep(),
            instance.pendingWake() != null ? instance.pendingWake().name() : null,
            codec.writeStepHistory(instance.stepHistory()),
            instance.error(),
            instance.errorCode(),
            toTimestamp(instance.createdAt()),
            toTimestamp(instance.updatedAt()),
            toTimestamp(instance.nextWakeAt()),
            toTimestamp(instance.completedAt()),
            instance.version()
        );

        if (rows == 0) {
            log.debug("Active execution already exists for {}:{}", instance.workflowId(), instance.entityId());
        }
        return rows == 1;
    }

    @Override
    public void update(ExecutionInstance instance, long expectedVersion) {
        String sql = """
            UPDATE execution_instances SET
                status = ?,
                current_step_index = ?,
                context = ?::jsonb,
                retry_count_for_current_step = ?,
                pending_wake = ?,
                step_history = ?::jsonb,
                error = ?,
                error_code = ?,
                updated_at = ?,
                next_wake_at = ?,
                completed_at = ?,
                version = ?
            WHERE id = ? AND version = ?
            """;

        int rows = jdbcTemplate.update(sql,
            instance.status().name(),
            instance.currentStepIndex(),
            codec.write(instance.context()),
            instance.retryCountForCurrentStep(),
            instance.pendingWake() != null ? instance.pendingWake().name() : null,
            codec.writeStepHistory(instance.stepHistory()),
            instance.error(),
            instance.errorCode(),
            toTimestamp(instance.updatedAt()),
            toTimestamp(instance.nextWakeAt()),
            toTimestamp(instance.completedAt()),
            instance.version(),
            instance.id(),
            expectedVersion
        );

        if (rows == 0) {
            throw new OptimisticLockException("ExecutionInstance", instance.id().toString(), expectedVersion);
        }
    }

    @Override
    public Optional<ExecutionInstance> findById(UUID id) {
        List<ExecutionInstance> results = jdbcTemplate.query(
            "SELECT * FROM execution_instances WHERE id = ?", rowMapper, id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<ExecutionInstance> findActive(String workflowId, String entityId) {
        String sql = """
            SELECT * FROM execution_instances
            WHERE workflow_id = ? AND entity_id = ? AND status IN %s
            """.formatted(ACTIVE_STATUSES);
        List<ExecutionInstance> results = jdbcTemplate.query(sql, rowMapper, workflowId, entityId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<ExecutionInstance> findLatestFinished(String workflowId, String entityId) {
        String sql = """
            SELECT * FROM execution_instances
            WHERE workflow_id = ? AND entity_id = ?
              AND status IN ('COMPLETED', 'FAILED')
              AND completed_at IS NOT NULL
            ORDER BY completed_at DESC
            LIMIT 1
            """;
        List<ExecutionInstance> results = jdbcTemplate.query(sql, rowMapper, workflowId, entityId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public long countByWorkflowAndEntity(String workflowId, String entityId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM execution_instances WHERE workflow_id = ? AND entity_id = ?",
            Long.class, workflowId, entityId);
        return count != null ? count : 0;
    }

    @Override
    public List<ExecutionInstance> findByWorkflow(String workflowId, Instant createdSince) {
        if (createdSince == null) {
            return jdbcTemplate.query(
                "SELECT * FROM execution_instances WHERE workflow_id = ? ORDER BY created_at",
                rowMapper, workflowId);
        }
        return jdbcTemplate.query(
            "SELECT * FROM execution_instances WHERE workflow_id = ? AND created_at >= ? ORDER BY created_at",
            rowMapper, workflowId, Timestamp.from(createdSince));
    }

    @Override
    public List<ExecutionInstance> findByEntity(String entityId) {
        return jdbcTemplate.query(
            "SELECT * FROM execution_instances WHERE entity_id = ? ORDER BY created_at",
            rowMapper, entityId);
    }

    @Override
    public List<ExecutionInstance> findOverdueWaiting(Instant wakeBefore, int limit) {
        String sql = """
            SELECT * FROM execution_instances
            WHERE status = 'WAITING' AND next_wake_at < ?
            ORDER BY next_wake_at
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, Timestamp.from(wakeBefore), limit);
    }

    @Override
    public Map<ExecutionStatus, Long> countByStatus() {
        Map<ExecutionStatus, Long> counts = new EnumMap<>(ExecutionStatus.class);
        jdbcTemplate.query("SELECT status, COUNT(*) AS count FROM execution_instances GROUP BY status",
            rs -> {
                counts.put(ExecutionStatus.valueOf(rs.getString("status")), rs.getLong("count"));
            });
        return counts;
    }

    // ========== Internal Methods ==========

    private ExecutionInstance mapRow(ResultSet rs, int rowNum) throws SQLException {
        String pendingWake = rs.getString("pending_wake");
        JsonNode context = codec.read(rs.getString("context"));
        return new ExecutionInstance(
            rs.getObject("id", UUID.class),
            rs.getString("workflow_id"),
            rs.getString("entity_id"),
            rs.getString("trigger_kind"),
            codec.read(rs.getString("trigger_payload")),
            ExecutionStatus.valueOf(rs.getString("status")),
            rs.getInt("current_step_index"),
            context instanceof ObjectNode object ? object : null,
            rs.getInt("retry_count_for_current_step"),
            pendingWake != null ? WakeAction.valueOf(pendingWake) : null,
            codec.readStepHistory(rs.getString("step_history")),
            rs.getString("error"),
            rs.getString("error_code"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at")),
            toInstant(rs.getTimestamp("next_wake_at")),
            toInstant(rs.getTimestamp("completed_at")),
            rs.getLong("version")
        );
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
