package com.baykanat.insider.warehouse.infrastructure.persistence;

import com.baykanat.insider.warehouse.domain.model.ExecutionRun;
import com.baykanat.insider.warehouse.domain.model.WarehouseStatistics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/** warehouse_execution_runs: batch insert, pencere özetleri ve retention silme. Kayıtlar güncellenmez. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class ExecutionRunJdbcRepository {

    private static final String INSERT_SQL = """
            INSERT INTO warehouse_execution_runs
                (query_name, target, source, duration_ms, row_count, from_cache, uninitialized, executed_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private final JdbcTemplate jdbcTemplate;

    public int[][] batchInsert(List<ExecutionRun> runs) {
        return jdbcTemplate.batchUpdate(INSERT_SQL, runs, runs.size(),
                (ps, run) -> {
                    ps.setString(1, run.getQueryName());
                    ps.setString(2, run.getTarget());
                    ps.setString(3, run.getSource() != null ? run.getSource().value() : null);
                    ps.setLong(4, run.getDurationMs());
                    ps.setInt(5, run.getRowCount());
                    ps.setBoolean(6, run.isFromCache());
                    ps.setBoolean(7, run.isUninitialized());
                    ps.setTimestamp(8, Timestamp.from(run.getExecutedAt() != null ? run.getExecutedAt() : Instant.now()));
                });
    }

    /** since'ten bu yana çalıştırmaların özeti; slowThresholdMs üstü yavaş sayılır. */
    public WarehouseStatistics.ExecutionSummary summarizeSince(Instant since, long slowThresholdMs) {
        return jdbcTemplate.queryForObject("""
                SELECT COUNT(*) AS total,
                       COUNT(*) FILTER (WHERE from_cache) AS cache_hits,
                       COUNT(*) FILTER (WHERE source = 'replica') AS replica_reads,
                       COUNT(*) FILTER (WHERE uninitialized) AS uninitialized,
                       COALESCE(AVG(duration_ms), 0) AS avg_duration_ms,
                       COALESCE(MAX(duration_ms), 0) AS max_duration_ms,
                       COUNT(*) FILTER (WHERE duration_ms > ?) AS slow_queries
                FROM warehouse_execution_runs
                WHERE executed_at >= ?
                """, (rs, rowNum) -> WarehouseStatistics.ExecutionSummary.builder()
                .total(rs.getLong("total"))
                .cacheHits(rs.getLong("cache_hits"))
                .replicaReads(rs.getLong("replica_reads"))
                .uninitialized(rs.getLong("uninitialized"))
                .avgDurationMs(rs.getDouble("avg_duration_ms"))
                .maxDurationMs(rs.getLong("max_duration_ms"))
                .slowQueries(rs.getLong("slow_queries"))
                .build(), slowThresholdMs, Timestamp.from(since));
    }

    public long countByQueryName(String queryName) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM warehouse_execution_runs WHERE query_name = ?", Long.class, queryName);
        return count != null ? count : 0L;
    }

    /** retentionDays'ten eski kayıtları siler. */
    public int deleteOlderThan(int retentionDays) {
        return jdbcTemplate.update(
                "DELETE FROM warehouse_execution_runs WHERE executed_at < NOW() - MAKE_INTERVAL(days => ?)",
                retentionDays);
    }
}
