package com.baykanat.health.store.api.controller;

import com.baykanat.health.store.api.dto.QueryResultResponse;
import com.baykanat.health.store.api.dto.ToolDescriptor;
import com.baykanat.health.store.domain.service.QueryToolService;
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
import java.util.Map;

/** Sorgu araçları için ince RPC sınırı: araç adı + argümanlar → satır tablosu. */
@Slf4j
@RestController
@RequestMapping("/tools")
@RequiredArgsConstructor
@Tag(name = "Query Tools", description = "query_duckdb, daily_agg and recent_raw over the partitioned dataset")
public class QueryToolController {

    private final QueryToolService queryToolService;

    @GetMapping
    @Operation(summary = "List query tools")
    public ResponseEntity<List<ToolDescriptor>> listTools() {
        return ResponseEntity.ok(queryToolService.listTools());
    }

    /** Gövde araç argümanlarıdır; boş gövde varsayılanlarla çalışır. */
    @PostMapping("/{toolName}")
    @Operation(summary = "Invoke a query tool", description = "Returns rows and row_count")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Query executed"),
            @ApiResponse(responseCode = "400", description = "Invalid arguments or SQL error"),
            @ApiResponse(responseCode = "404", description = "Unknown tool")
    })
    public ResponseEntity<QueryResultResponse> invoke(
            @Parameter(description = "Tool name", example = "daily_agg")
            @PathVariable("toolName") String toolName,
            @RequestBody(required = false) Map<String, Object> arguments
    ) {
        log.debug("Tool call: {}", toolName);
        return ResponseEntity.ok(queryToolService.invoke(toolName, arguments));
    }
}
