package com.baykanat.insider.warehouse.domain.catalog;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * İsimli, parametreli analitik sorgu. SQL named parameter kullanır ve LIMIT/OFFSET içermez;
 * sayfalama motor tarafından eklenir.
 */
@Value
@Builder
public class QueryDefinition {

    String name;
    String description;
    QueryTarget target;
    String sql;
    @Builder.Default
    ParameterSchema parameterSchema = ParameterSchema.empty();
    @Builder.Default
    int defaultLimit = 100;
    @Builder.Default
    int maxLimit = 10000;
    /** null ise motorun varsayılan statement timeout'u. */
    Duration statementTimeout;
    /** false ise replica gecikmesi kabul edilmez, her zaman primary'den okunur. */
    @Builder.Default
    boolean replicaEligible = true;
}
