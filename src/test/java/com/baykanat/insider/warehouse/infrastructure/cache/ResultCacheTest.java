package com.baykanat.insider.warehouse.infrastructure.cache;

import com.baykanat.insider.warehouse.domain.model.CacheLookup;
import com.baykanat.insider.warehouse.domain.model.QueryResult;
import com.baykanat.insider.warehouse.domain.model.QuerySource;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.doThrow;

/**
 * Unit tests for ResultCache over the in-memory store, plus store failure degradation.
 */
@ExtendWith(MockitoExtension.class)
class ResultCacheTest {

    private static final Duration TTL = Duration.ofMinutes(5);

    private final ResultCache cache = new ResultCache(new InMemoryResultCacheStore(100),
            JsonMapper.builder().findAndAddModules().build(), "warehouse");

    @Mock
    private ResultCacheStore failingStore;

    @Test
    @DisplayName("First lookup computes, second is served from the store")
    void missThenHit() {
        AtomicInteger computations = new AtomicInteger();

        CacheLookup<QueryResult> first = cache.getOrCompute("warehouse:v:q:1", QueryResult.class,
                () -> result(computations.incrementAndGet()), TTL);
        CacheLookup<QueryResult> second = cache.getOrCompute("warehouse:v:q:1", QueryResult.class,
                () -> result(computations.incrementAndGet()), TTL);

        assertThat(first.hit()).isFalse();
        assertThat(second.hit()).isTrue();
        assertThat(computations).hasValue(1);
        assertThat(second.value().getRowCount()).isEqualTo(1);
        assertThat(second.value().getSource()).isEqualTo(QuerySource.PRIMARY);
        assertThat(second.value().getDataAsOf()).isEqualTo(first.value().getDataAsOf());
        assertThat(cache.statistics().getHits()).isEqualTo(1);
        assertThat(cache.statistics().getMisses()).isEqualTo(1);
    }

    @Test
    @DisplayName("Invalidating a prefix removes only matching entries")
    void invalidatePrefix() {
        cache.getOrCompute("warehouse:view_a:q1:1", QueryResult.class, () -> result(1), TTL);
        cache.getOrCompute("warehouse:view_a:q2:1", QueryResult.class, () -> result(1), TTL);
        cache.getOrCompute("warehouse:view_b:q3:1", QueryResult.class, () -> result(1), TTL);

        long deleted = cache.invalidate("warehouse:view_a:");

        assertThat(deleted).isEqualTo(2);
        assertThat(cache.getOrCompute("warehouse:view_a:q1:1", QueryResult.class, () -> result(2), TTL).hit())
                .isFalse();
        assertThat(cache.getOrCompute("warehouse:view_b:q3:1", QueryResult.class, () -> result(2), TTL).hit())
                .isTrue();
    }

    @Test
    @DisplayName("Clear removes every entry under the root prefix")
    void clear() {
        cache.getOrCompute("warehouse:view_a:q1:1", QueryResult.class, () -> result(1), TTL);
        cache.getOrCompute("warehouse:live:q2:1", QueryResult.class, () -> result(1), TTL);

        assertThat(cache.clear()).isEqualTo(2);
        assertThat(cache.statistics().getInvalidatedEntries()).isEqualTo(2);
    }

    @Test
    @DisplayName("Store failures degrade to a computed miss and are counted")
    void storeFailureDegradesToMiss() {
        when(failingStore.get(anyString())).thenThrow(new CacheStoreUnavailableException("down", null));
        doThrow(new CacheStoreUnavailableException("down", null)).when(failingStore)
                .put(anyString(), anyString(), any(Duration.class));
        ResultCache degraded = new ResultCache(failingStore, JsonMapper.builder().findAndAddModules().build(),
                "warehouse");

        CacheLookup<QueryResult> lookup = degraded.getOrCompute("warehouse:v:q:1", QueryResult.class,
                () -> result(3), TTL);

        assertThat(lookup.hit()).isFalse();
        assertThat(lookup.value().getRowCount()).isEqualTo(3);
        assertThat(degraded.statistics().getStoreFailures()).isEqualTo(2);
    }

    @Test
    @DisplayName("Unreadable cached JSON is discarded and recomputed")
    void unreadableEntry() {
        InMemoryResultCacheStore store = new InMemoryResultCacheStore(10);
        store.put("warehouse:v:q:1", "{not json", TTL);
        ResultCache withGarbage = new ResultCache(store, JsonMapper.builder().findAndAddModules().build(),
                "warehouse");

        CacheLookup<QueryResult> lookup = withGarbage.getOrCompute("warehouse:v:q:1", QueryResult.class,
                () -> result(1), TTL);

        assertThat(lookup.hit()).isFalse();
        assertThat(withGarbage.getOrCompute("warehouse:v:q:1", QueryResult.class, () -> result(1), TTL).hit())
                .isTrue();
    }

    @Test
    @DisplayName("A result computed before an invalidation of its prefix is not written back")
    void invalidationDuringComputeSkipsWrite() {
        String key = "warehouse:student_grade_summary:top_performers:1";

        CacheLookup<QueryResult> stale = cache.getOrCompute(key, QueryResult.class, () -> {
            cache.invalidate("warehouse:student_grade_summary:");
            return result(1);
        }, TTL);
        CacheLookup<QueryResult> next = cache.getOrCompute(key, QueryResult.class, () -> result(2), TTL);

        assertThat(stale.hit()).isFalse();
        assertThat(stale.value().getRowCount()).isEqualTo(1);
        assertThat(next.hit()).isFalse();
        assertThat(next.value().getRowCount()).isEqualTo(2);
        assertThat(cache.getOrCompute(key, QueryResult.class, () -> result(3), TTL).value().getRowCount())
                .isEqualTo(2);
    }

    @Test
    @DisplayName("Invalidating an unrelated prefix during compute still caches the result")
    void unrelatedInvalidationKeepsWrite() {
        String key = "warehouse:student_grade_summary:top_performers:1";

        cache.getOrCompute(key, QueryResult.class, () -> {
            cache.invalidate("warehouse:teacher_workload_summary:");
            return result(1);
        }, TTL);

        assertThat(cache.getOrCompute(key, QueryResult.class, () -> result(2), TTL).hit()).isTrue();
    }

    @Test
    @DisplayName("Recompute started before an invalidation does not overwrite the cleared entry")
    void recomputeRacingInvalidation() {
        String key = "warehouse:student_grade_summary:top_performers:1";

        cache.recompute(key, QueryResult.class, () -> {
            cache.clear();
            return result(1);
        }, TTL);

        assertThat(cache.getOrCompute(key, QueryResult.class, () -> result(2), TTL).hit()).isFalse();
    }

    @Test
    @DisplayName("Miss and hit return rows with the same value types")
    void missAndHitCarrySameTypes() {
        QueryResult computed = QueryResult.builder()
                .queryName("q")
                .rows(List.of(Map.<String, Object>of("student_id", 42L,
                        "last_submission_at", Instant.parse("2024-05-01T02:00:00Z"))))
                .rowCount(1)
                .limit(10)
                .offset(0)
                .source(QuerySource.PRIMARY)
                .build();

        CacheLookup<QueryResult> miss = cache.getOrCompute("warehouse:v:types:1", QueryResult.class,
                () -> computed, TTL);
        CacheLookup<QueryResult> hit = cache.getOrCompute("warehouse:v:types:1", QueryResult.class,
                () -> computed, TTL);

        assertThat(miss.hit()).isFalse();
        assertThat(hit.hit()).isTrue();
        assertThat(miss.value().getRows()).isEqualTo(hit.value().getRows());
        assertThat(miss.value().getRows().get(0).get("student_id").getClass())
                .isEqualTo(hit.value().getRows().get(0).get("student_id").getClass());
    }

    private static QueryResult result(int rows) {
        List<Map<String, Object>> data = IntStream.range(0, rows)
                .<Map<String, Object>>mapToObj(i -> Map.of("student_id", i))
                .toList();
        return QueryResult.builder()
                .queryName("q")
                .rows(data)
                .rowCount(rows)
                .limit(10)
                .offset(0)
                .source(QuerySource.PRIMARY)
                .dataAsOf(Instant.parse("2024-05-01T02:00:00Z"))
                .build();
    }
}
