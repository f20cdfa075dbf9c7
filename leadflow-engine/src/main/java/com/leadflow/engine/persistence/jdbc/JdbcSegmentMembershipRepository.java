package com.leadflow.engine.persistence.jdbc;

import com.leadflow.core.model.SegmentMembership;
import com.leadflow.core.repository.SegmentMembershipRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of SegmentMembershipRepository.
 * A partial unique index allows one open membership per (segment, entity).
 */
@Repository("jdbcSegmentMembershipRepository")
public class JdbcSegmentMembershipRepository implements SegmentMembershipRepository {

    private static final RowMapper<SegmentMembership> ROW_MAPPER = (rs, rowNum) -> {
        Timestamp leftAt = rs.getTimestamp("left_at");
        return new SegmentMembership(
            rs.getObject("id", UUID.class),
            rs.getString("segment_id"),
            rs.getString("entity_id"),
            rs.getTimestamp("joined_at").toInstant(),
            rs.getString("added_by"),
            rs.getString("reason"),
            leftAt != null ? leftAt.toInstant() : null,
            rs.getString("left_reason")
        );
    };

    private final JdbcTemplate jdbcTemplate;

    public JdbcSegmentMembershipRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean insertIfNotMember(SegmentMembership membership) {
        String sql = """
            INSERT INTO segment_memberships (id, segment_id, entity_id, joined_at, added_by, reason)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT DO NOTHING
            """;
        return jdbcTemplate.update(sql,
            membership.id(),
            membership.segmentId(),
            membership.entityId(),
            Timestamp.from(membership.joinedAt()),
            membership.addedBy(),
            membership.reason()
        ) == 1;
    }

    @Override
    public boolean close(UUID membershipId, Instant leftAt, String reason) {
        String sql = "UPDATE segment_memberships SET left_at = ?, left_reason = ? WHERE id = ? AND left_at IS NULL";
        return jdbcTemplate.update(sql, Timestamp.from(leftAt), reason, membershipId) == 1;
    }

    @Override
    public Optional<SegmentMembership> findActive(String segmentId, String entityId) {
        List<SegmentMembership> results = jdbcTemplate.query(
            "SELECT * FROM segment_memberships WHERE segment_id = ? AND entity_id = ? AND left_at IS NULL",
            ROW_MAPPER, segmentId, entityId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<SegmentMembership> findActiveBySegment(String segmentId) {
        return jdbcTemplate.query(
            "SELECT * FROM segment_memberships WHERE segment_id = ? AND left_at IS NULL ORDER BY joined_at",
            ROW_MAPPER, segmentId);
    }

    @Override
    public List<SegmentMembership> findActiveByEntity(String entityId) {
        return jdbcTemplate.query(
            "SELECT * FROM segment_memberships WHERE entity_id = ? AND left_at IS NULL ORDER BY joined_at",
            ROW_MAPPER, entityId);
    }

    @Override
    public List<SegmentMembership> findHistory(String segmentId, String entityId) {
        return jdbcTemplate.query(
            "SELECT * FROM segment_memberships WHERE segment_id = ? AND entity_id = ? ORDER BY joined_at",
            ROW_MAPPER, segmentId, entityId);
    }

    @Override
    public long countActive(String segmentId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM segment_memberships WHERE segment_id = ? AND left_at IS NULL",
            Long.class, segmentId);
        return count != null ? count : 0;
    }
}
