package com.baykanat.insider.warehouse.domain.mapper;

import com.baykanat.insider.warehouse.api.dto.QueryDefinitionResponse;
import com.baykanat.insider.warehouse.api.dto.QueryResponse;
import com.baykanat.insider.warehouse.domain.catalog.ParameterSpec;
import com.baykanat.insider.warehouse.domain.catalog.ParameterType;
import com.baykanat.insider.warehouse.domain.catalog.QueryDefinition;
import com.baykanat.insider.warehouse.domain.catalog.QueryTarget;
import com.baykanat.insider.warehouse.domain.model.QueryResult;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.util.List;

/** Domain sonuçları → API DTO'ları. */
@Mapper(componentModel = "spring")
public interface QueryResponseMapper {

    QueryResponse toResponse(QueryResult result);

    @Mapping(target = "parameters", source = "parameterSchema.specs")
    QueryDefinitionResponse toResponse(QueryDefinition definition);

    List<QueryDefinitionResponse> toResponses(List<QueryDefinition> definitions);

    QueryDefinitionResponse.Parameter toParameter(ParameterSpec spec);

    default String targetName(QueryTarget target) {
        return target == null ? null : target.keySegment();
    }

    default String typeName(ParameterType type) {
        return type == null ? null : type.name().toLowerCase();
    }
}
