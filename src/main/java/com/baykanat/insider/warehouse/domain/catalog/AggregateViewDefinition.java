package com.baykanat.insider.warehouse.domain.catalog;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/** İsimli, versiyonlu aggregate view tanımı; indexColumns view'ın unique key'idir (CONCURRENTLY refresh için şart). */
@Value
@Builder
public class AggregateViewDefinition {

    String name;
    @Builder.Default
    int version = 1;
    String description;
    String refreshStatement;
    @Singular
    List<String> indexColumns;
}
