package com.baykanat.insider.warehouse.domain.service;

import com.baykanat.insider.warehouse.config.AppProperties;
import com.baykanat.insider.warehouse.domain.catalog.QueryCatalog;
import com.baykanat.insider.warehouse.domain.catalog.QueryDefinition;
import com.baykanat.insider.warehouse.domain.exception.QueryValidationException;
import com.baykanat.insider.warehouse.domain.exception.StatementTimeoutException;
import com.baykanat.insider.warehouse.domain.model.CacheLookup;
import com.baykanat.insider.warehouse.domain.model.QueryRequest;
import com.baykanat.insider.warehouse.domain.model.QueryResult;
import com.baykanat.insider.warehouse.infrastructure.cache.ResultCache;
import com.baykanat.insider.warehouse.infrastructure.persistence.ReplicaRouter;
import com.baykanat.insider.warehouse.infrastructure.persistence.ViewNotPopulatedException;
import com.baykanat.insider.warehouse.infrastructure.persistence.WarehouseQueryJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Katalog sorgularını çalıştırır: parametre doğrulama, sayfa sınırlama, cache, replica yönlendirme,
 * statement timeout ve her çalıştırma için ExecutionRun.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WarehouseQueryService {

    private final QueryCatalog queryCatalog;
    private final ViewRefreshService viewRefreshService;
    private final ResultCache resultCache;
    private final CacheKeyFactory cacheKeyFactory;
    private final ReplicaRouter replicaRouter;
    private final WarehouseQueryJdbcRepository queryRepository;
    private final ExecutionRunRecorder executionRunRecorder;
    private final AppProperties appProperties;

    public QueryResult execute(QueryRequest request) {
        return execute(request, false);
    }

    /** Cache'e bakmadan hesaplayıp cache'i tazeler (warm). */
    public QueryResult recompute(QueryRequest request) {
        return execute(request, true);
    }

    public List<QueryDefinition> listQueries() {
        return queryCatalog.all();
    }

    private QueryResult execute(QueryRequest request, boolean forceRecompute) {
        QueryDefinition query = queryCatalog.require(request.getQueryName());
        SortedMap<String, Object> parameters = query.getParameterSchema().validate(request.getParameters());
        int limit = resolveLimit(query, request.getLimit());
        int offset = resolveOffset(request.getOffset());
        boolean preferReplica = request.isUseReplica() && query.isReplicaEligible();

        long start = System.nanoTime();
        QueryResult result;
        if (query.getTarget().isView() && !viewRefreshService.isInitialized(query.getTarget().getViewName())) {
            log.debug("View {} has never been refreshed, {} returns uninitialized",
                    query.getTarget().getViewName(), query.getName());
            result = QueryResult.uninitialized(query.getName(), limit, offset);
        } else {
            result = cachedOrComputed(query, parameters, limit, offset, preferReplica, forceRecompute);
        }

        executionRunRecorder.record(query, result, elapsedMs(start));
        return result;
    }

    private QueryResult cachedOrComputed(QueryDefinition query, SortedMap<String, Object> parameters,
                                         int limit, int offset, boolean preferReplica, boolean forceRecompute) {
        String key = cacheKeyFactory.key(query, parameters, limit, offset);
        Duration ttl = Duration.ofSeconds(appProperties.getCache().getTtlSeconds());
        try {
            if (forceRecompute) {
                return resultCache.recompute(key, QueryResult.class,
                        () -> compute(query, parameters, limit, offset, preferReplica), ttl);
            }
            CacheLookup<QueryResult> lookup = resultCache.getOrCompute(key, QueryResult.class,
                    () -> compute(query, parameters, limit, offset, preferReplica), ttl);
            return lookup.hit() ? lookup.value().toBuilder().fromCache(true).build() : lookup.value();
        } catch (ViewNotPopulatedException e) {
            viewRefreshService.markUninitialized(query.getTarget().getViewName());
            log.debug("{}", e.getMessage());
            return QueryResult.uninitialized(query.getName(), limit, offset);
        }
    }

    private QueryResult compute(QueryDefinition query, SortedMap<String, Object> parameters,
                                int limit, int offset, boolean preferReplica) {
        Duration timeout = query.getStatementTimeout() != null
                ? query.getStatementTimeout()
                : Duration.ofSeconds(appProperties.getWarehouse().getStatementTimeoutSeconds());

        long start = System.nanoTime();
        ReplicaRouter.Routed<List<Map<String, Object>>> routed;
        try {
            routed = replicaRouter.route(query.getName(), preferReplica,
                    source -> queryRepository.fetch(query, parameters, limit + 1, offset, timeout, source));
        } catch (StatementTimeoutException e) {
            log.warn("Query {} cancelled after {}ms statement timeout", query.getName(), timeout.toMillis());
            throw e;
        }
        long durationMs = elapsedMs(start);
        if (durationMs > appProperties.getWarehouse().getSlowQueryThresholdMs()) {
            log.warn("Slow query {}: {}ms from {} with parameters {}",
                    query.getName(), durationMs, routed.source().value(), parameters);
        }

        List<Map<String, Object>> rows = routed.value();
        boolean hasMore = rows.size() > limit;
        List<Map<String, Object>> page = hasMore ? List.copyOf(rows.subList(0, limit)) : rows;
        Instant dataAsOf = query.getTarget().isView()
                ? viewRefreshService.lastRefreshedAt(query.getTarget().getViewName()).orElse(null)
                : null;

        return QueryResult.builder()
                .queryName(query.getName())
                .rows(page)
                .rowCount(page.size())
                .limit(limit)
                .offset(offset)
                .hasMore(hasMore)
                .fromCache(false)
                .source(routed.source())
                .dataAsOf(dataAsOf)
                .build();
    }

    /** null → sorgunun varsayılanı; aksi halde [1, maxLimit] aralığına sıkıştırılır. */
    static int resolveLimit(QueryDefinition query, Integer requested) {
        if (requested == null) {
            return query.getDefaultLimit();
        }
        return Math.max(1, Math.min(requested, query.getMaxLimit()));
    }

    static int resolveOffset(Integer requested) {
        if (requested == null) {
            return 0;
        }
        if (requested < 0) {
            throw new QueryValidationException("Invalid pagination",
                    Map.of("offset", "must be >= 0"));
        }
        return requested;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
