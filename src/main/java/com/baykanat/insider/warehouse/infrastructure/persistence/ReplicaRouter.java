package com.baykanat.insider.warehouse.infrastructure.persistence;

import com.baykanat.insider.warehouse.domain.exception.ReplicaUnavailableException;
import com.baykanat.insider.warehouse.domain.model.QuerySource;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Okumaları replica'ya yönlendirir; replica bağlantı hatasında tek bir WARN ile primary'ye düşer.
 * "replica" circuit breaker açıkken replica hiç denenmez.
 */
@Slf4j
@Component
public class ReplicaRouter {

    static final String CIRCUIT_BREAKER = "replica";

    private final WarehouseConnections connections;
    private final CircuitBreaker circuitBreaker;

    public ReplicaRouter(WarehouseConnections connections, CircuitBreakerRegistry circuitBreakerRegistry) {
        this.connections = connections;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER);
    }

    /** Sonucu ve hangi bağlantıdan geldiğini döner. */
    public <T> Routed<T> route(String queryName, boolean preferReplica, Function<QuerySource, T> work) {
        if (!preferReplica || !connections.hasReplica()) {
            return new Routed<>(work.apply(QuerySource.PRIMARY), QuerySource.PRIMARY);
        }
        if (!circuitBreaker.tryAcquirePermission()) {
            log.debug("Replica circuit breaker {}, reading {} from primary", circuitBreaker.getState(), queryName);
            return new Routed<>(work.apply(QuerySource.PRIMARY), QuerySource.PRIMARY);
        }

        long start = System.nanoTime();
        T value;
        try {
            value = work.apply(QuerySource.REPLICA);
        } catch (ReplicaUnavailableException e) {
            circuitBreaker.onError(System.nanoTime() - start, TimeUnit.NANOSECONDS, e);
            log.warn("Replica unavailable for query {}, falling back to primary: {}", queryName, e.getMessage());
            return new Routed<>(work.apply(QuerySource.PRIMARY), QuerySource.PRIMARY);
        } catch (RuntimeException e) {
            // replica sağlığıyla ilgisiz hatalar (timeout, SQL hatası) breaker'ı etkilemez
            circuitBreaker.releasePermission();
            throw e;
        }
        circuitBreaker.onSuccess(System.nanoTime() - start, TimeUnit.NANOSECONDS);
        return new Routed<>(value, QuerySource.REPLICA);
    }

    public record Routed<T>(T value, QuerySource source) {
    }
}
