package com.baykanat.insider.warehouse.domain.service;

import com.baykanat.insider.warehouse.config.AppProperties;
import com.baykanat.insider.warehouse.domain.model.CacheWarmReport;
import com.baykanat.insider.warehouse.domain.model.QueryRequest;
import com.baykanat.insider.warehouse.domain.model.QueryResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Sorguları varsayılan parametre ve sayfa ile çalıştırıp cache'i önceden doldurur; hatalar sorgu bazında raporlanır. */
@Slf4j
@Service
@RequiredArgsConstructor
public class CacheWarmingService {

    private final WarehouseQueryService queryService;
    private final AppProperties appProperties;

    /** app.cache.warm-queries listesini ısıtır. */
    public CacheWarmReport warmConfigured() {
        return warm(appProperties.getCache().getWarmQueries());
    }

    public CacheWarmReport warm(List<String> queryNames) {
        List<String> warmed = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (String name : queryNames) {
            try {
                QueryResult result = queryService.recompute(QueryRequest.of(name, Map.of()));
                if (result.isUninitialized()) {
                    failures.put(name, "target view has not been refreshed yet");
                } else {
                    warmed.add(name);
                }
            } catch (RuntimeException e) {
                log.warn("Cache warm failed for {}: {}", name, e.getMessage());
                failures.put(name, e.getMessage());
            }
        }
        log.info("Cache warm finished: warmed={}, failed={}", warmed, failures.keySet());
        return CacheWarmReport.builder().warmed(warmed).failures(failures).build();
    }
}
