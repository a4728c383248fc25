package com.baykanat.insider.warehouse.domain.service;

import com.baykanat.insider.warehouse.config.AppProperties;
import com.baykanat.insider.warehouse.domain.catalog.AggregateViewDefinition;
import com.baykanat.insider.warehouse.domain.catalog.AggregateViewRegistry;
import com.baykanat.insider.warehouse.domain.exception.RefreshFailureException;
import com.baykanat.insider.warehouse.domain.model.RefreshResult;
import com.baykanat.insider.warehouse.domain.model.ViewState;
import com.baykanat.insider.warehouse.infrastructure.cache.ResultCache;
import com.baykanat.insider.warehouse.infrastructure.persistence.AggregateViewJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Aggregate view yenileme. Aynı view için süreç içinde tek refresh; farklı view'lar paralel yenilenebilir.
 * Başarılı refresh sonrası view'ı okuyan sorguların cache kayıtları hemen silinir.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ViewRefreshService {

    private final AggregateViewRegistry registry;
    private final AggregateViewJdbcRepository repository;
    private final ResultCache resultCache;
    private final CacheKeyFactory cacheKeyFactory;
    private final AppProperties appProperties;

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Set<String> initializedViews = ConcurrentHashMap.newKeySet();

    public RefreshResult refresh(String viewName) {
        AggregateViewDefinition definition = registry.require(viewName);
        ReentrantLock lock = locks.computeIfAbsent(definition.getName(), name -> new ReentrantLock());
        lock.lock();
        try {
            return doRefresh(definition);
        } finally {
            lock.unlock();
        }
    }

    /** Bir kez doldurulduğu görülen view için cevap hafızada tutulur; aksi halde state tablosu okunur. */
    public boolean isInitialized(String viewName) {
        if (initializedViews.contains(viewName)) {
            return true;
        }
        boolean initialized = repository.findState(viewName).map(ViewState::isInitialized).orElse(false);
        if (initialized) {
            initializedViews.add(viewName);
        }
        return initialized;
    }

    /** View'ın boş olduğu sorgu sırasında anlaşılırsa hafızadaki işaret kaldırılır. */
    public void markUninitialized(String viewName) {
        initializedViews.remove(viewName);
    }

    public Optional<Instant> lastRefreshedAt(String viewName) {
        return repository.findState(viewName).map(ViewState::getLastRefreshedAt);
    }

    public List<ViewState> states() {
        return repository.findAllStates();
    }

    private RefreshResult doRefresh(AggregateViewDefinition definition) {
        String name = definition.getName();
        boolean concurrently = repository.isPopulated(name);
        log.info("Refreshing aggregate view {} ({})", name, concurrently ? "concurrently" : "initial population");
        RefreshResult result;
        try {
            result = repository.refresh(name, concurrently,
                    appProperties.getWarehouse().getRefreshTimeoutSeconds());
        } catch (RuntimeException e) {
            RefreshFailureException failure = new RefreshFailureException(name, e);
            log.error("Aggregate view refresh failed: {}", failure.getMessage());
            recordFailure(name, failure.getMessage());
            throw failure;
        }
        initializedViews.add(name);
        long invalidated = resultCache.invalidate(cacheKeyFactory.viewPrefix(name));
        log.info("Aggregate view {} refreshed: rows={}, duration={}ms, invalidated cache entries={}",
                name, result.getRowsWritten(), result.getDurationMs(), invalidated);
        return result;
    }

    private void recordFailure(String viewName, String message) {
        try {
            repository.recordFailure(viewName, message);
        } catch (RuntimeException e) {
            log.warn("Could not record refresh failure for {}: {}", viewName, e.getMessage());
        }
    }
}
