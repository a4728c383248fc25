package com.baykanat.insider.warehouse.domain.catalog;

import com.baykanat.insider.warehouse.domain.exception.ConfigurationException;
import com.baykanat.insider.warehouse.domain.exception.UnknownViewException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/** Aggregate view tanımlarının kaydı; tekrarlanan veya hatalı tanım ConfigurationException. */
@Slf4j
public class AggregateViewRegistry {

    static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]{0,62}");

    private final Map<String, AggregateViewDefinition> views = new ConcurrentHashMap<>();
    private final List<String> order = new CopyOnWriteArrayList<>();

    /** İsim, refresh sorgusu ve index kolonlarıyla view kaydeder (versiyon 1). */
    public AggregateViewDefinition define(String name, String refreshStatement, List<String> indexColumns) {
        return define(AggregateViewDefinition.builder()
                .name(name)
                .refreshStatement(refreshStatement)
                .indexColumns(indexColumns == null ? List.of() : indexColumns)
                .build());
    }

    public synchronized AggregateViewDefinition define(AggregateViewDefinition definition) {
        validate(definition);
        if (views.putIfAbsent(definition.getName(), definition) != null) {
            throw new ConfigurationException("Duplicate aggregate view definition: " + definition.getName());
        }
        order.add(definition.getName());
        log.debug("Registered aggregate view {} v{} keyed by {}",
                definition.getName(), definition.getVersion(), definition.getIndexColumns());
        return definition;
    }

    public Optional<AggregateViewDefinition> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(views.get(name));
    }

    public AggregateViewDefinition require(String name) {
        return find(name).orElseThrow(() -> new UnknownViewException(name));
    }

    public boolean contains(String name) {
        return name != null && views.containsKey(name);
    }

    /** Kayıt sırasıyla tüm view'lar. */
    public List<AggregateViewDefinition> all() {
        return order.stream().map(views::get).toList();
    }

    private void validate(AggregateViewDefinition definition) {
        String name = definition.getName();
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new ConfigurationException("Aggregate view name must be a lower-case SQL identifier: " + name);
        }
        if (QueryTarget.LIVE.equals(name)) {
            throw new ConfigurationException("Aggregate view name '" + QueryTarget.LIVE + "' is reserved for live-table queries");
        }
        if (definition.getVersion() < 1) {
            throw new ConfigurationException("Aggregate view " + name + " must have a positive version");
        }
        if (definition.getRefreshStatement() == null || definition.getRefreshStatement().isBlank()) {
            throw new ConfigurationException("Aggregate view " + name + " has no refresh statement");
        }
        if (definition.getIndexColumns().isEmpty()) {
            throw new ConfigurationException("Aggregate view " + name + " declares no index columns");
        }
        for (String column : definition.getIndexColumns()) {
            if (column == null || !IDENTIFIER.matcher(column).matches()) {
                throw new ConfigurationException("Aggregate view " + name + " has malformed index column: " + column);
            }
        }
        if (definition.getIndexColumns().stream().distinct().count() != definition.getIndexColumns().size()) {
            throw new ConfigurationException("Aggregate view " + name + " repeats an index column");
        }
    }
}
