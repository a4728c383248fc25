package com.baykanat.insider.warehouse.api.controller;

import com.baykanat.insider.warehouse.api.dto.QueryDefinitionResponse;
import com.baykanat.insider.warehouse.api.dto.QueryExecutionRequest;
import com.baykanat.insider.warehouse.api.dto.QueryResponse;
import com.baykanat.insider.warehouse.domain.mapper.QueryResponseMapper;
import com.baykanat.insider.warehouse.domain.model.QueryRequest;
import com.baykanat.insider.warehouse.domain.model.QueryResult;
import com.baykanat.insider.warehouse.domain.service.WarehouseQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/** Dashboard sorguları: katalog listesi ve isimli sorgu çalıştırma. */
@Slf4j
@RestController
@RequestMapping("/analytics/queries")
@RequiredArgsConstructor
@Tag(name = "Analytics queries", description = "Parameterized analytics queries over aggregate views")
public class AnalyticsQueryController {

    private final WarehouseQueryService queryService;
    private final QueryResponseMapper queryResponseMapper;

    @GetMapping
    @Operation(summary = "List catalog queries", description = "Returns every registered query with its parameter schema")
    public ResponseEntity<List<QueryDefinitionResponse>> listQueries() {
        return ResponseEntity.ok(queryResponseMapper.toResponses(queryService.listQueries()));
    }

    @PostMapping("/{name}")
    @Operation(summary = "Execute a catalog query",
            description = "Validates parameters, clamps the page and answers from cache, replica or primary")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Query executed (uninitialized=true if the view was never refreshed)"),
            @ApiResponse(responseCode = "400", description = "Invalid parameters or pagination"),
            @ApiResponse(responseCode = "404", description = "Unknown query"),
            @ApiResponse(responseCode = "504", description = "Statement timeout exceeded")
    })
    public ResponseEntity<QueryResponse> execute(
            @Parameter(description = "Query name", example = "student_progress")
            @PathVariable("name") String name,
            @RequestBody(required = false) QueryExecutionRequest body
    ) {
        QueryExecutionRequest request = body != null ? body : new QueryExecutionRequest();
        QueryResult result = queryService.execute(QueryRequest.builder()
                .queryName(name)
                .parameters(request.getParameters())
                .limit(request.getLimit())
                .offset(request.getOffset())
                .useReplica(!Boolean.FALSE.equals(request.getUseReplica()))
                .build());
        return ResponseEntity.ok(queryResponseMapper.toResponse(result));
    }
}
