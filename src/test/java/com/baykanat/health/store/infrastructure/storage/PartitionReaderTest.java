package com.baykanat.health.store.infrastructure.storage;

import com.baykanat.health.store.api.dto.PartitionDataResponse;
import com.baykanat.health.store.domain.exception.ErrorCode;
import com.baykanat.health.store.domain.exception.HealthStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for PartitionReader: union of columns across part files, ordering and limits.
 */
class PartitionReaderTest {

    @TempDir
    Path root;

    private StoreFixture store;

    @BeforeEach
    void setUp() {
        store = new StoreFixture(root);
    }

    @Test
    @DisplayName("Rows with different fields come back with every column, absent ones null")
    void mergesColumnsAcrossFiles() {
        store.writer.append(StoreFixture.steps(100.0, "2025-03-01T08:00:00Z"));
        store.writer.append(StoreFixture.heartRate(72.0, "2025-03-01T09:30:00Z"));

        PartitionDataResponse response = store.reader.read("2025-03-01", 10);

        assertThat(response.getStatus()).isEqualTo(PartitionDataResponse.STATUS_SUCCESS);
        assertThat(response.getDate()).isEqualTo("2025-03-01");
        assertThat(response.getTotalRecords()).isEqualTo(2);
        assertThat(response.getReturnedRecords()).isEqualTo(2);

        Map<String, Object> first = response.getData().get(0);
        Map<String, Object> second = response.getData().get(1);
        assertThat(first).containsEntry("stepCount", 100.0).containsEntry("heartRate", null);
        assertThat(second).containsEntry("heartRate", 72.0).containsEntry("stepCount", null);
        assertThat(first.keySet()).isEqualTo(second.keySet());
    }

    @Test
    @DisplayName("Limit keeps the last N rows by event time")
    void limitReturnsLatestRows() {
        store.writer.append(StoreFixture.steps(3.0, "2025-03-01T15:00:00Z"));
        store.writer.append(StoreFixture.steps(1.0, "2025-03-01T07:00:00Z"));
        store.writer.append(StoreFixture.steps(2.0, "2025-03-01T11:00:00Z"));

        PartitionDataResponse response = store.reader.read("2025-03-01", 2);

        assertThat(response.getTotalRecords()).isEqualTo(3);
        assertThat(response.getReturnedRecords()).isEqualTo(2);
        assertThat(response.getData()).extracting(row -> row.get("stepCount")).containsExactly(2.0, 3.0);
    }

    @Test
    @DisplayName("Missing partition is reported as not_found, not as an error")
    void missingPartitionIsNotFound() {
        PartitionDataResponse response = store.reader.read("2024-01-01", 10);

        assertThat(response.getStatus()).isEqualTo(PartitionDataResponse.STATUS_NOT_FOUND);
        assertThat(response.getTotalRecords()).isZero();
        assertThat(response.getData()).isEmpty();
    }

    @Test
    @DisplayName("Omitted date reads today's partition")
    void omittedDateReadsToday() {
        store.writer.append(StoreFixture.steps(10.0, "2025-03-01T06:00:00Z"));

        assertThat(store.reader.read(null, 10).getTotalRecords()).isEqualTo(1);
    }

    @Test
    @DisplayName("Unreadable part file fails the whole read with PARTITION_READ_FAILED")
    void corruptFileFailsRead() throws Exception {
        store.writer.append(StoreFixture.steps(10.0, "2025-03-01T06:00:00Z"));
        Files.writeString(root.resolve("year=2025/month=03/day=01/part-corrupt.parquet"), "not parquet");

        assertThatThrownBy(() -> store.reader.read("2025-03-01", 10))
                .isInstanceOf(HealthStoreException.class)
                .extracting("code").isEqualTo(ErrorCode.PARTITION_READ_FAILED);
    }

    @Test
    @DisplayName("Malformed date fails with MALFORMED_DATE")
    void malformedDateRejected() {
        assertThatThrownBy(() -> store.reader.read("2025/03/01", 10))
                .isInstanceOf(HealthStoreException.class)
                .extracting("code").isEqualTo(ErrorCode.MALFORMED_DATE);
    }
}
