package com.baykanat.insider.warehouse.domain.catalog;

import com.baykanat.insider.warehouse.domain.exception.ConfigurationException;
import com.baykanat.insider.warehouse.domain.exception.UnknownQueryException;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Açılışta yüklenen statik sorgu kataloğu; tanımlar view kaydı ve motorun satır üst sınırıyla doğrulanır. */
@Slf4j
public class QueryCatalog {

    /** Sayfalama için motorun eklediği parametre adları. */
    public static final String LIMIT_PARAM = "page_limit";
    public static final String OFFSET_PARAM = "page_offset";

    private static final Set<String> RESERVED = Set.of(LIMIT_PARAM, OFFSET_PARAM);

    private final Map<String, QueryDefinition> queries;

    public QueryCatalog(List<QueryDefinition> definitions, AggregateViewRegistry views, int maxResultRows) {
        Map<String, QueryDefinition> byName = new LinkedHashMap<>();
        for (QueryDefinition definition : definitions) {
            validate(definition, views, maxResultRows);
            if (byName.putIfAbsent(definition.getName(), definition) != null) {
                throw new ConfigurationException("Duplicate query definition: " + definition.getName());
            }
        }
        this.queries = Map.copyOf(byName);
        log.info("Query catalog loaded: {} queries over {} aggregate views", queries.size(), views.all().size());
    }

    public Optional<QueryDefinition> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(queries.get(name));
    }

    public QueryDefinition require(String name) {
        return find(name).orElseThrow(() -> new UnknownQueryException(name));
    }

    /** İsme göre sıralı tüm tanımlar. */
    public List<QueryDefinition> all() {
        return queries.values().stream()
                .sorted((a, b) -> a.getName().compareTo(b.getName()))
                .toList();
    }

    /** Verilen view'ı okuyan sorgular. */
    public List<QueryDefinition> readingView(String viewName) {
        return all().stream()
                .filter(q -> q.getTarget().isView() && q.getTarget().getViewName().equals(viewName))
                .toList();
    }

    private static void validate(QueryDefinition definition, AggregateViewRegistry views, int maxResultRows) {
        String name = definition.getName();
        if (name == null || !AggregateViewRegistry.IDENTIFIER.matcher(name).matches()) {
            throw new ConfigurationException("Query name must be a lower-case identifier: " + name);
        }
        if (definition.getSql() == null || definition.getSql().isBlank()) {
            throw new ConfigurationException("Query " + name + " has no SQL");
        }
        if (definition.getTarget() == null) {
            throw new ConfigurationException("Query " + name + " declares no target");
        }
        if (definition.getTarget().isView() && !views.contains(definition.getTarget().getViewName())) {
            throw new ConfigurationException("Query " + name + " targets unknown view "
                    + definition.getTarget().getViewName());
        }
        if (definition.getMaxLimit() < 1 || definition.getMaxLimit() > maxResultRows) {
            throw new ConfigurationException("Query " + name + " max_limit " + definition.getMaxLimit()
                    + " must be within [1, " + maxResultRows + "]");
        }
        if (definition.getDefaultLimit() < 1 || definition.getDefaultLimit() > definition.getMaxLimit()) {
            throw new ConfigurationException("Query " + name + " default_limit " + definition.getDefaultLimit()
                    + " must be within [1, " + definition.getMaxLimit() + "]");
        }
        if (definition.getStatementTimeout() != null
                && (definition.getStatementTimeout().isNegative() || definition.getStatementTimeout().isZero())) {
            throw new ConfigurationException("Query " + name + " has a non-positive statement timeout");
        }
        for (ParameterSpec spec : definition.getParameterSchema().getSpecs()) {
            if (spec.getName() == null || RESERVED.contains(spec.getName())) {
                throw new ConfigurationException("Query " + name + " declares reserved parameter " + spec.getName());
            }
            if (spec.getType() == null) {
                throw new ConfigurationException("Query " + name + " parameter " + spec.getName() + " has no type");
            }
        }
    }
}
