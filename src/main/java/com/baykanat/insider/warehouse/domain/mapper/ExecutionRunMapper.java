package com.baykanat.insider.warehouse.domain.mapper;

import com.baykanat.insider.warehouse.domain.model.ExecutionRun;
import com.baykanat.insider.warehouse.domain.model.QueryResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.time.Instant;

/** QueryResult → ExecutionRun ve Kafka record value → ExecutionRun dönüşümleri. */
@Mapper(componentModel = "spring")
public interface ExecutionRunMapper {

    ObjectMapper JSON_MAPPER = JsonMapper.builder().findAndAddModules().build();

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "queryName", source = "result.queryName")
    @Mapping(target = "source", source = "result.source")
    @Mapping(target = "rowCount", source = "result.rowCount")
    @Mapping(target = "fromCache", source = "result.fromCache")
    @Mapping(target = "uninitialized", source = "result.uninitialized")
    @Mapping(target = "target", source = "target")
    @Mapping(target = "durationMs", source = "durationMs")
    @Mapping(target = "executedAt", source = "executedAt")
    ExecutionRun toExecutionRun(QueryResult result, String target, long durationMs, Instant executedAt);

    /** Kafka value ExecutionRun ise döner, değilse Map vb. üzerinden çevirir. */
    default ExecutionRun fromRecordValue(Object value) {
        if (value instanceof ExecutionRun run) {
            return run;
        }
        return JSON_MAPPER.convertValue(value, ExecutionRun.class);
    }
}
