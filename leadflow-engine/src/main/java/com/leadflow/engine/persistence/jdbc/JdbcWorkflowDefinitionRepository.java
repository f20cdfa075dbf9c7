package com.leadflow.engine.persistence.jdbc;

import com.leadflow.core.model.WorkflowDefinition;
import com.leadflow.core.repository.WorkflowDefinitionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of WorkflowDefinitionRepository.
 * Definitions are immutable once stored apart from the active flag.
 *
 * Uses JSONB columns for:
 * - Entry rules
 * - Steps, including their parameters and skip_if rules
 * - Retry policy
 */
@Repository("jdbcWorkflowDefinitionRepository")
public class JdbcWorkflowDefinitionRepository implements WorkflowDefinitionRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcWorkflowDefinitionRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final DefinitionJsonCodec codec;
    private final RowMapper<WorkflowDefinition> rowMapper;

    public JdbcWorkflowDefinitionRepository(JdbcTemplate jdbcTemplate, DefinitionJsonCodec codec) {
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
        this.rowMapper = this::mapRow;
    }

    @Override
    @Transactional
    public void save(WorkflowDefinition definition) {
        String sql = """
            INSERT INTO workflow_definitions (
                id, name, version, trigger_kind, entry_rules, steps,
                active, max_concurrent_per_entity, max_entries_per_entity, cooldown_ms,
                retry_policy, created_at, created_by, description, category
            ) VALUES (?, ?, ?, ?, ?::jsonb, ?::jsonb, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?)
            """;

        jdbcTemplate.update(sql,
            definition.id(),
            definition.name(),
            definition.version(),
            definition.triggerKind(),
            codec.writeRules(definition.entryRules()),
            codec.writeSteps(definition.steps()),
            definition.active(),
            definition.maxConcurrentPerEntity(),
            definition.maxEntriesPerEntity(),
            definition.cooldown().toMillis(),
            codec.writeRetryPolicy(definition.retryPolicy()),
            Timestamp.from(definition.createdAt()),
            definition.createdBy(),
            definition.description(),
            definition.category()
        );

        log.debug("Saved workflow definition {}", definition.id());
    }

    @Override
    public boolean setActive(String id, boolean active) {
        return jdbcTemplate.update("UPDATE workflow_definitions SET active = ? WHERE id = ?", active, id) == 1;
    }

    @Override
    public Optional<WorkflowDefinition> findById(String id) {
        List<WorkflowDefinition> results = jdbcTemplate.query(
            "SELECT * FROM workflow_definitions WHERE id = ?", rowMapper, id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<WorkflowDefinition> findLatest(String name) {
        String sql = """
            SELECT * FROM workflow_definitions
            WHERE name = ?
            ORDER BY version DESC
            LIMIT 1
            """;
        List<WorkflowDefinition> results = jdbcTemplate.query(sql, rowMapper, name);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<WorkflowDefinition> findVersions(String name) {
        return jdbcTemplate.query(
            "SELECT * FROM workflow_definitions WHERE name = ? ORDER BY version", rowMapper, name);
    }

    @Override
    public List<WorkflowDefinition> findActiveByTriggerKind(String triggerKind) {
        return jdbcTemplate.query(
            "SELECT * FROM workflow_definitions WHERE trigger_kind = ? AND active ORDER BY name",
            rowMapper, triggerKind);
    }

    @Override
    public List<WorkflowDefinition> findAllActive() {
        return jdbcTemplate.query(
            "SELECT * FROM workflow_definitions WHERE active ORDER BY name", rowMapper);
    }

    @Override
    public int getNextVersion(String name) {
        Integer max = jdbcTemplate.queryForObject(
            "SELECT MAX(version) FROM workflow_definitions WHERE name = ?", Integer.class, name);
        return max == null ? 1 : max + 1;
    }

    private WorkflowDefinition mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new WorkflowDefinition(
            rs.getString("id"),
            rs.getString("name"),
            rs.getInt("version"),
            rs.getString("trigger_kind"),
            codec.readRules(rs.getString("entry_rules")),
            codec.readSteps(rs.getString("steps")),
            rs.getBoolean("active"),
            rs.getInt("max_concurrent_per_entity"),
            rs.getInt("max_entries_per_entity"),
            Duration.ofMillis(rs.getLong("cooldown_ms")),
            codec.readRetryPolicy(rs.getString("retry_policy")),
            rs.getTimestamp("created_at").toInstant(),
            rs.getString("created_by"),
            rs.getString("description"),
            rs.getString("category")
        );
    }
}
