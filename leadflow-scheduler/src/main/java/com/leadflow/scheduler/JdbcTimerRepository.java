package com.leadflow.scheduler;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of TimerRepository.
 * The table holds pending wakes only, at most one per execution; claiming a
 * wake deletes its row.
 */
@Repository("jdbcTimerRepository")
public class JdbcTimerRepository implements TimerRepository {

    private static final RowMapper<ScheduledWake> ROW_MAPPER = (rs, rowNum) -> new ScheduledWake(
        rs.getObject("wake_id", UUID.class),
        rs.getObject("execution_id", UUID.class),
        rs.getTimestamp("fire_at").toInstant(),
        rs.getTimestamp("created_at").toInstant()
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcTimerRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void upsert(ScheduledWake wake) {
        String sql = """
            INSERT INTO scheduled_wakes (wake_id, execution_id, fire_at, created_at)
            VALUES (?, ?, ?, ?)
            ON CONFLICT (execution_id) DO UPDATE SET
                wake_id = EXCLUDED.wake_id,
                fire_at = EXCLUDED.fire_at,
                created_at = EXCLUDED.created_at
            """;
        jdbcTemplate.update(sql,
            wake.wakeId(),
            wake.executionId(),
            Timestamp.from(wake.fireAt()),
            Timestamp.from(wake.createdAt())
        );
    }

    @Override
    public List<ScheduledWake> findDue(Instant now, int limit) {
        String sql = """
            SELECT * FROM scheduled_wakes
            WHERE fire_at <= ?
            ORDER BY fire_at
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, ROW_MAPPER, Timestamp.from(now), limit);
    }

    @Override
    public boolean claim(UUID wakeId) {
        return jdbcTemplate.update("DELETE FROM scheduled_wakes WHERE wake_id = ?", wakeId) == 1;
    }

    @Override
    public int cancelForExecution(UUID executionId) {
        return jdbcTemplate.update("DELETE FROM scheduled_wakes WHERE execution_id = ?", executionId);
    }

    @Override
    public Optional<ScheduledWake> findPending(UUID executionId) {
        String sql = "SELECT * FROM scheduled_wakes WHERE execution_id = ?";
        List<ScheduledWake> results = jdbcTemplate.query(sql, ROW_MAPPER, executionId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public long countPending() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM scheduled_wakes", Long.class);
        return count != null ? count : 0;
    }
}
