package com.baykanat.health.store.domain.service;

import com.baykanat.health.store.api.dto.FileStatsResponse;
import com.baykanat.health.store.domain.exception.ErrorCode;
import com.baykanat.health.store.domain.exception.HealthStoreException;
import com.baykanat.health.store.infrastructure.storage.StoreFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for InventoryService over a real temporary store.
 */
class InventoryServiceTest {

    @TempDir
    Path root;

    private StoreFixture store;
    private InventoryService inventoryService;

    @BeforeEach
    void setUp() {
        store = new StoreFixture(root);
        inventoryService = new InventoryService(store.layout);
    }

    @Test
    @DisplayName("Every part file is listed with its row count, size and relative path")
    void listsAllPartFiles() {
        store.writer.append(StoreFixture.steps(1.0, "2025-03-01T06:00:00Z"));
        store.writer.append(StoreFixture.steps(2.0, "2025-03-01T07:00:00Z"));
        store.writer.append(StoreFixture.heartRate(60.0, "2025-02-28T07:00:00Z"));

        FileStatsResponse stats = inventoryService.stats();

        assertThat(stats.getTotalFiles()).isEqualTo(3);
        assertThat(stats.getTotalRecords()).isEqualTo(3);
        assertThat(stats.getTotalSizeBytes())
                .isEqualTo(stats.getFiles().stream().mapToLong(FileStatsResponse.FileStat::getSizeBytes).sum())
                .isPositive();
        assertThat(stats.getFiles()).allSatisfy(file -> {
            assertThat(file.getPath()).matches("year=2025/month=0[23]/day=\\d{2}/part-.+\\.parquet");
            assertThat(file.getRecordsCount()).isEqualTo(1);
            assertThat(file.getModifiedAt()).isNotBlank();
        });
    }

    @Test
    @DisplayName("Non part files are ignored")
    void ignoresForeignFiles() throws Exception {
        store.writer.append(StoreFixture.steps(1.0, "2025-03-01T06:00:00Z"));
        Files.writeString(root.resolve("year=2025/month=03/day=01/notes.txt"), "hello");

        assertThat(inventoryService.stats().getTotalFiles()).isEqualTo(1);
    }

    @Test
    @DisplayName("Missing store root reports an empty inventory")
    void missingRootIsEmpty() {
        InventoryService empty = new InventoryService(new StoreFixture(root.resolve("absent")).layout);

        FileStatsResponse stats = empty.stats();

        assertThat(stats.getTotalFiles()).isZero();
        assertThat(stats.getTotalRecords()).isZero();
        assertThat(stats.getFiles()).isEmpty();
    }

    @Test
    @DisplayName("One unreadable file fails the whole report with INVENTORY_READ_FAILED")
    void corruptFileFailsReport() throws Exception {
        store.writer.append(StoreFixture.steps(1.0, "2025-03-01T06:00:00Z"));
        Files.writeString(root.resolve("year=2025/month=03/day=01/part-broken.parquet"), "garbage");

        assertThatThrownBy(() -> inventoryService.stats())
                .isInstanceOf(HealthStoreException.class)
                .extracting("code").isEqualTo(ErrorCode.INVENTORY_READ_FAILED);
    }

    @Test
    @DisplayName("Sizes are reported in MB with two decimals")
    void megabytesRounded() {
        assertThat(InventoryService.toMegabytes(1024L * 1024L)).isEqualTo(1.0);
        assertThat(InventoryService.toMegabytes(1572864L)).isEqualTo(1.5);
        assertThat(InventoryService.toMegabytes(800L)).isEqualTo(0.0);
    }
}
