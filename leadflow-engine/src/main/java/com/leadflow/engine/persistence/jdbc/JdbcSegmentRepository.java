package com.leadflow.engine.persistence.jdbc;

import com.leadflow.core.model.SegmentDefinition;
import com.leadflow.core.repository.SegmentRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of SegmentRepository.
 */
@Repository("jdbcSegmentRepository")
public class JdbcSegmentRepository implements SegmentRepository {

    private final JdbcTemplate jdbcTemplate;
    private final DefinitionJsonCodec codec;
    private final RowMapper<SegmentDefinition> rowMapper;

    public JdbcSegmentRepository(JdbcTemplate jdbcTemplate, DefinitionJsonCodec codec) {
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
        this.rowMapper = this::mapRow;
    }

    @Override
    public void save(SegmentDefinition segment) {
        String sql = """
            INSERT INTO segments (id, name, description, rules, dynamic, active, priority, created_at)
            VALUES (?, ?, ?, ?::jsonb, ?, ?, ?, ?)
            ON CONFLICT (id) DO UPDATE SET
                name = EXCLUDED.name,
                description = EXCLUDED.description,
                rules = EXCLUDED.rules,
                dynamic = EXCLUDED.dynamic,
                active = EXCLUDED.active,
                priority = EXCLUDED.priority
            """;
        jdbcTemplate.update(sql,
            segment.id(),
            segment.name(),
            segment.description(),
            codec.writeRules(segment.rules()),
            segment.dynamic(),
            segment.active(),
            segment.priority(),
            segment.createdAt() != null ? Timestamp.from(segment.createdAt()) : null
        );
    }

    @Override
    public Optional<SegmentDefinition> findById(String id) {
        List<SegmentDefinition> results = jdbcTemplate.query("SELECT * FROM segments WHERE id = ?", rowMapper, id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<SegmentDefinition> findActiveDynamic() {
        return jdbcTemplate.query(
            "SELECT * FROM segments WHERE active AND dynamic ORDER BY priority DESC, id", rowMapper);
    }

    @Override
    public List<SegmentDefinition> findAll() {
        return jdbcTemplate.query("SELECT * FROM segments ORDER BY id", rowMapper);
    }

    private SegmentDefinition mapRow(ResultSet rs, int rowNum) throws SQLException {
        Timestamp createdAt = rs.getTimestamp("created_at");
        return new SegmentDefinition(
            rs.getString("id"),
            rs.getString("name"),
            rs.getString("description"),
            codec.readRules(rs.getString("rules")),
            rs.getBoolean("dynamic"),
            rs.getBoolean("active"),
            rs.getInt("priority"),
            createdAt != null ? createdAt.toInstant() : null
        );
    }
}
