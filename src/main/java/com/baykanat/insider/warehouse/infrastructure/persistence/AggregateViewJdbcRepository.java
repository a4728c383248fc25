package com.baykanat.insider.warehouse.infrastructure.persistence;

import com.baykanat.insider.warehouse.domain.catalog.AggregateViewDefinition;
import com.baykanat.insider.warehouse.domain.model.RefreshResult;
import com.baykanat.insider.warehouse.domain.model.ViewState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Materialized view DDL'i, REFRESH ve warehouse_view_state kayıtları; hepsi primary üzerinde. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class AggregateViewJdbcRepository {

    private static final RowMapper<ViewState> STATE_MAPPER = (rs, rowNum) -> ViewState.builder()
            .viewName(rs.getString("view_name"))
            .definitionVersion(rs.getInt("definition_version"))
            .lastRefreshedAt(toInstant(rs.getTimestamp("last_refreshed_at")))
            .lastRowsWritten(rs.getObject("last_rows_written", Long.class))
            .lastDurationMs(rs.getObject("last_duration_ms", Long.class))
            .lastError(rs.getString("last_error"))
            .updatedAt(toInstant(rs.getTimestamp("updated_at")))
            .build();

    private static final String STATE_COLUMNS = """
            view_name, definition_version, last_refreshed_at, last_rows_written,
            last_duration_ms, last_error, updated_at
            """;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public Optional<ViewState> findState(String viewName) {
        List<ViewState> states = jdbcTemplate.query(
                "SELECT " + STATE_COLUMNS + " FROM warehouse_view_state WHERE view_name = ?",
                STATE_MAPPER, viewName);
        return states.stream().findFirst();
    }

    public List<ViewState> findAllStates() {
        return jdbcTemplate.query(
                "SELECT " + STATE_COLUMNS + " FROM warehouse_view_state ORDER BY view_name", STATE_MAPPER);
    }

    public boolean exists(String viewName) {
        Boolean exists = jdbcTemplate.queryForObject("""
                SELECT EXISTS (SELECT 1 FROM pg_matviews
                               WHERE schemaname = current_schema() AND matviewname = ?)
                """, Boolean.class, viewName);
        return Boolean.TRUE.equals(exists);
    }

    /** View var ve en az bir kez doldurulmuş mu. */
    public boolean isPopulated(String viewName) {
        List<Boolean> populated = jdbcTemplate.queryForList("""
                SELECT ispopulated FROM pg_matviews
                WHERE schemaname = current_schema() AND matviewname = ?
                """, Boolean.class, viewName);
        return !populated.isEmpty() && Boolean.TRUE.equals(populated.get(0));
    }

    /** View'ı boş (WITH NO DATA) oluşturur, unique index'i ekler ve state satırını sıfırlar. */
    public void create(AggregateViewDefinition definition) {
        String name = definition.getName();
        transactionTemplate.executeWithoutResult(status -> {
            jdbcTemplate.execute("CREATE MATERIALIZED VIEW IF NOT EXISTS " + name + " AS\n"
                    + definition.getRefreshStatement().strip() + "\nWITH NO DATA");
            jdbcTemplate.execute("CREATE UNIQUE INDEX IF NOT EXISTS " + name + "_uidx ON " + name
                    + " (" + String.join(", ", definition.getIndexColumns()) + ")");
            resetState(name, definition.getVersion());
        });
        log.info("Created materialized view {} (v{})", name, definition.getVersion());
    }

    public void drop(String viewName) {
        jdbcTemplate.execute("DROP MATERIALIZED VIEW IF EXISTS " + viewName + " CASCADE");
        log.info("Dropped materialized view {}", viewName);
    }

    /** Mevcut view için state satırı yoksa oluşturur; varsa dokunmaz. */
    public void ensureState(String viewName, int version, boolean populated) {
        jdbcTemplate.update("""
                INSERT INTO warehouse_view_state (view_name, definition_version, last_refreshed_at, updated_at)
                VALUES (?, ?, CASE WHEN ? THEN NOW() END, NOW())
                ON CONFLICT (view_name) DO NOTHING
                """, viewName, version, populated);
    }

    /**
     * REFRESH, satır sayımı ve state güncellemesi tek transaction'da. Hata olursa eski içerik yerinde kalır.
     * İlk doldurma CONCURRENTLY desteklemez.
     */
    public RefreshResult refresh(String viewName, boolean concurrently, int timeoutSeconds) {
        long start = System.currentTimeMillis();
        return Objects.requireNonNull(transactionTemplate.execute(status -> {
            jdbcTemplate.queryForObject("SELECT set_config('statement_timeout', ?, true)",
                    String.class, timeoutSeconds + "s");
            jdbcTemplate.execute("REFRESH MATERIALIZED VIEW " + (concurrently ? "CONCURRENTLY " : "") + viewName);
            Long rows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + viewName, Long.class);
            long rowsWritten = rows != null ? rows : 0L;
            long durationMs = System.currentTimeMillis() - start;
            Instant refreshedAt = Instant.now();
            jdbcTemplate.update("""
                    UPDATE warehouse_view_state
                    SET last_refreshed_at = ?, last_rows_written = ?, last_duration_ms = ?,
                        last_error = NULL, updated_at = NOW()
                    WHERE view_name = ?
                    """, Timestamp.from(refreshedAt), rowsWritten, durationMs, viewName);
            return RefreshResult.builder()
                    .viewName(viewName)
                    .rowsWritten(rowsWritten)
                    .durationMs(durationMs)
                    .refreshedAt(refreshedAt)
                    .build();
        }));
    }

    public void recordFailure(String viewName, String error) {
        jdbcTemplate.update(
                "UPDATE warehouse_view_state SET last_error = ?, updated_at = NOW() WHERE view_name = ?",
                error, viewName);
    }

    private void resetState(String viewName, int version) {
        jdbcTemplate.update("""
                INSERT INTO warehouse_view_state (view_name, definition_version, updated_at)
                VALUES (?, ?, NOW())
                ON CONFLICT (view_name) DO UPDATE
                SET definition_version = EXCLUDED.definition_version, last_refreshed_at = NULL,
                    last_rows_written = NULL, last_duration_ms = NULL, last_error = NULL, updated_at = NOW()
                """, viewName, version);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
