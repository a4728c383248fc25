package com.baykanat.insider.warehouse.config;

import com.baykanat.insider.warehouse.domain.catalog.AggregateViewDefinition;
import com.baykanat.insider.warehouse.domain.catalog.AggregateViewRegistry;
import com.baykanat.insider.warehouse.domain.catalog.AnalyticsCatalog;
import com.baykanat.insider.warehouse.domain.catalog.QueryCatalog;
import com.baykanat.insider.warehouse.domain.catalog.QueryDefinition;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/** View kaydı ve sorgu kataloğu; yerleşik tanımlara context'teki ek tanım bean'leri eklenir. */
@Configuration
public class WarehouseCatalogConfig {

    @Bean
    public AggregateViewRegistry aggregateViewRegistry(ObjectProvider<AggregateViewDefinition> extraViews) {
        AggregateViewRegistry registry = new AggregateViewRegistry();
        AnalyticsCatalog.views().forEach(registry::define);
        extraViews.orderedStream().forEach(registry::define);
        return registry;
    }

    @Bean
    public QueryCatalog queryCatalog(AggregateViewRegistry aggregateViewRegistry,
                                     ObjectProvider<QueryDefinition> extraQueries,
                                     AppProperties appProperties) {
        List<QueryDefinition> definitions = new ArrayList<>(AnalyticsCatalog.queries());
        extraQueries.orderedStream().forEach(definitions::add);
        return new QueryCatalog(definitions, aggregateViewRegistry, appProperties.getWarehouse().getMaxResultRows());
    }
}
