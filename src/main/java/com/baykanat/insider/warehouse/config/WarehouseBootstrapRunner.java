package com.baykanat.insider.warehouse.config;

import com.baykanat.insider.warehouse.domain.catalog.AggregateViewDefinition;
import com.baykanat.insider.warehouse.domain.catalog.AggregateViewRegistry;
import com.baykanat.insider.warehouse.domain.model.ViewState;
import com.baykanat.insider.warehouse.infrastructure.persistence.AggregateViewJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Açılışta kayıtlı view'ları veritabanıyla eşitler: eksik view boş oluşturulur, versiyonu değişen view
 * düşürülüp yeniden oluşturulur. View'lar ilk refresh'e kadar uninitialized kalır.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class WarehouseBootstrapRunner implements ApplicationRunner {

    private final AggregateViewRegistry viewRegistry;
    private final AggregateViewJdbcRepository viewRepository;

    @Override
    public void run(ApplicationArguments args) {
        for (AggregateViewDefinition definition : viewRegistry.all()) {
            synchronize(definition);
        }
    }

    void synchronize(AggregateViewDefinition definition) {
        String name = definition.getName();
        Optional<ViewState> state = viewRepository.findState(name);
        boolean exists = viewRepository.exists(name);

        if (state.isPresent() && state.get().getDefinitionVersion() != definition.getVersion()) {
            log.info("Aggregate view {} definition changed (v{} -> v{}), recreating",
                    name, state.get().getDefinitionVersion(), definition.getVersion());
            viewRepository.drop(name);
            viewRepository.create(definition);
        } else if (!exists) {
            viewRepository.create(definition);
        } else {
            viewRepository.ensureState(name, definition.getVersion(), viewRepository.isPopulated(name));
            log.debug("Aggregate view {} v{} is up to date", name, definition.getVersion());
        }
    }
}
