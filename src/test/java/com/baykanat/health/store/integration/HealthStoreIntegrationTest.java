package com.baykanat.health.store.integration;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Integration test that drives the full application over HTTP against a real
 * Parquet store in a temporary directory and an in-memory DuckDB.
 *
 * <p>This test validates:
 * <ul>
 *   <li>Ingested events land in their day partition and read back with merged columns</li>
 *   <li>daily_agg and recent_raw see the same files through DuckDB</li>
 *   <li>Inventory and partition delete reflect the store state</li>
 * </ul>
 *
 * <p>The clock is fixed at 2025-03-01 12:00 UTC so "today" is deterministic.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class HealthStoreIntegrationTest {

    private static final Path STORE_ROOT;

    static {
        try {
            STORE_ROOT = Files.createTempDirectory("health-store-it");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("app.storage.root", STORE_ROOT::toString);
    }

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        @Primary
        Clock fixedClock() {
            return Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("Ingest, read, aggregate, inspect and delete one day end to end")
    void fullLifecycle() throws Exception {
        ingest(Map.of("stepCount", 100.0, "timestamp", "2025-03-01T08:00:00Z"));
        ingest(Map.of("heartRate", 72.0, "timestamp", "2025-03-01T09:30:00Z"));

        mockMvc.perform(get("/health-data").param("date", "2025-03-01").param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.total_records").value(2))
                .andExpect(jsonPath("$.data[0].stepCount").value(100.0))
                .andExpect(jsonPath("$.data[0]", hasKey("heartRate")))
                .andExpect(jsonPath("$.data[0].heartRate").value(nullValue()))
                .andExpect(jsonPath("$.data[1].heartRate").value(72.0));

        mockMvc.perform(post("/tools/daily_agg")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"days\": 1}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.row_count").value(1))
                .andExpect(jsonPath("$.rows[0].date").value("2025-03-01"))
                .andExpect(jsonPath("$.rows[0].steps").value(100.0))
                .andExpect(jsonPath("$.rows[0].kcal").value(nullValue()));

        mockMvc.perform(post("/tools/recent_raw"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.row_count").value(2))
                .andExpect(jsonPath("$.rows[0].timestamp").value("2025-03-01T08:00:00Z"));

        mockMvc.perform(get("/health-data/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_files").value(2))
                .andExpect(jsonPath("$.total_records").value(2));

        mockMvc.perform(delete("/health-data/2025-03-01"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted_files").value(2));

        mockMvc.perform(get("/health-data").param("date", "2025-03-01"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("not_found"));

        mockMvc.perform(delete("/health-data/2025-03-01"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("PARTITION_NOT_FOUND"));
    }

    @Test
    @DisplayName("Invalid inputs are rejected with their error codes and write nothing")
    void invalidInputs() throws Exception {
        mockMvc.perform(post("/health-data")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("timestamp", "2025-13-45T99:00:00Z"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_TIMESTAMP"));

        mockMvc.perform(get("/health-data").param("date", "2025-02-30"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MALFORMED_DATE"));

        mockMvc.perform(delete("/health-data/2025-3-1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_DATE_FORMAT"));

        mockMvc.perform(post("/tools/query_duckdb")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sql\": \"SELEC 1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("QUERY_EXECUTION_FAILED"));

        mockMvc.perform(post("/tools/unknown_tool"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("UNKNOWN_TOOL"));
    }

    @Test
    @DisplayName("State created by one query_duckdb call is not visible to the next call")
    void toolCallsDoNotShareDatabaseState() throws Exception {
        mockMvc.perform(post("/tools/query_duckdb")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sql\": \"CREATE TABLE scratch AS SELECT 1 AS x\"}"))
                .andExpect(status().isOk());

        mockMvc.perform(post("/tools/query_duckdb")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sql\": \"SELECT * FROM scratch\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("QUERY_EXECUTION_FAILED"));
    }

    @Test
    @DisplayName("Status endpoints report a healthy service")
    void statusEndpoints() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"));
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Health Store API"));
    }

    private void ingest(Map<String, Object> payload) throws Exception {
        mockMvc.perform(post("/health-data")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(payload)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.records_written").value(1));
    }
}
