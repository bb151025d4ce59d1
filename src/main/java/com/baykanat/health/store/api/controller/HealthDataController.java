package com.baykanat.health.store.api.controller;

import com.baykanat.health.store.api.dto.DeletePartitionResponse;
import com.baykanat.health.store.api.dto.FileStatsResponse;
import com.baykanat.health.store.api.dto.HealthDataRequest;
import com.baykanat.health.store.api.dto.IngestResponse;
import com.baykanat.health.store.api.dto.PartitionDataResponse;
import com.baykanat.health.store.domain.service.HealthDataService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** POST/GET/DELETE /health-data ve GET /health-data/stats; tüm iş HealthDataService'te. */
@Slf4j
@RestController
@RequestMapping("/health-data")
@RequiredArgsConstructor
@Validated
@Tag(name = "Health Data", description = "Event ingestion, daily partition reads and store inventory")
public class HealthDataController {

    private final HealthDataService healthDataService;

    /** Event'i senkron olarak kendi partition'ına yazar; 201 + dosya yolu. */
    @PostMapping
    @Operation(summary = "Ingest one event", description = "Persists the event as a new Parquet part file")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Event persisted"),
            @ApiResponse(responseCode = "400", description = "Invalid payload or timestamp"),
            @ApiResponse(responseCode = "500", description = "Storage write failed")
    })
    public ResponseEntity<IngestResponse> ingest(@Valid @RequestBody HealthDataRequest request) {
        log.debug("Received event with timestamp={}", request.getTimestamp());
        return ResponseEntity.status(HttpStatus.CREATED).body(healthDataService.ingest(request));
    }

    /** Günün kayıtları; partition yoksa 200 + status=not_found. */
    @GetMapping
    @Operation(summary = "Read one daily partition", description = "Merges all part files of the day; defaults to today")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Partition read (or not_found)"),
            @ApiResponse(responseCode = "400", description = "Malformed date"),
            @ApiResponse(responseCode = "500", description = "A part file could not be read")
    })
    public ResponseEntity<PartitionDataResponse> read(
            @Parameter(description = "Partition date (YYYY-MM-DD), default today", example = "2025-03-01")
            @RequestParam(value = "date", required = false) String date,

            @Parameter(description = "Return the last N records", example = "100")
            @RequestParam(value = "limit", required = false) @Min(1) Integer limit
    ) {
        return ResponseEntity.ok(healthDataService.read(date, limit));
    }

    @GetMapping("/stats")
    @Operation(summary = "Store inventory", description = "Record count, size and timestamps for every part file")
    public ResponseEntity<FileStatsResponse> fileStats() {
        return ResponseEntity.ok(healthDataService.fileStats());
    }

    /** Tüm günü siler; tek dosya silme yok. */
    @DeleteMapping("/{date}")
    @Operation(summary = "Delete a daily partition")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Partition deleted"),
            @ApiResponse(responseCode = "400", description = "Date is not YYYY-MM-DD"),
            @ApiResponse(responseCode = "404", description = "Partition does not exist")
    })
    public ResponseEntity<DeletePartitionResponse> deletePartition(
            @Parameter(description = "Partition date (YYYY-MM-DD)", example = "2025-03-01")
            @PathVariable("date") String date
    ) {
        return ResponseEntity.ok(healthDataService.deletePartition(date));
    }
}
