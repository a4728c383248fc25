package com.baykanat.insider.warehouse.infrastructure.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/** Postgres katalog istatistikleri: materialized view boyutları ve tablo canlı satır sayıları. */
@Repository
@RequiredArgsConstructor
public class StatisticsJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    /** matview adı → diskteki toplam boyut (byte). */
    public Map<String, Long> materializedViewSizes() {
        Map<String, Long> sizes = new LinkedHashMap<>();
        jdbcTemplate.query("""
                SELECT matviewname, pg_total_relation_size(format('%I.%I', schemaname, matviewname)::regclass) AS size_bytes
                FROM pg_matviews
                WHERE schemaname = current_schema()
                ORDER BY matviewname
                """, rs -> {
            sizes.put(rs.getString("matviewname"), rs.getLong("size_bytes"));
        });
        return sizes;
    }

    /** Tablo adı → pg_stat_user_tables.n_live_tup; istatistiği olmayan tablo listede yer almaz. */
    public Map<String, Long> liveRowCounts(Collection<String> tables) {
        Map<String, Long> counts = new LinkedHashMap<>();
        if (tables.isEmpty()) {
            return counts;
        }
        jdbcTemplate.query("""
                SELECT relname, n_live_tup
                FROM pg_stat_user_tables
                WHERE schemaname = current_schema() AND relname = ANY (?)
                ORDER BY relname
                """, ps -> ps.setArray(1, ps.getConnection().createArrayOf("text", tables.toArray())),
                rs -> {
                    counts.put(rs.getString("relname"), rs.getLong("n_live_tup"));
                });
        return counts;
    }
}
