package com.baykanat.health.store.domain.service;

import com.baykanat.health.store.api.dto.FileStatsResponse;
import com.baykanat.health.store.domain.exception.ErrorCode;
import com.baykanat.health.store.domain.exception.HealthStoreException;
import com.baykanat.health.store.infrastructure.storage.ParquetPartFile;
import com.baykanat.health.store.infrastructure.storage.StorageLayout;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/** Store kökünü özyinelemeli tarar; her part dosyası için satır sayısı, boyut ve zaman bilgisi. */
@Slf4j
@Service
@RequiredArgsConstructor
public class InventoryService {

    private static final BigDecimal BYTES_PER_MB = BigDecimal.valueOf(1024L * 1024L);

    private final StorageLayout layout;

    /** Tek okunamayan dosya tüm raporu INVENTORY_READ_FAILED ile düşürür; kısmi sonuç yok. */
    public FileStatsResponse stats() {
        Path root = layout.root();
        if (!Files.isDirectory(root)) {
            return FileStatsResponse.builder().totalFiles(0).files(List.of()).build();
        }

        List<Path> files;
        try (Stream<Path> walk = Files.walk(root)) {
            files = walk.filter(Files::isRegularFile).filter(layout::isPartFile).sorted().toList();
        } catch (IOException | RuntimeException e) {
            throw new HealthStoreException(ErrorCode.INVENTORY_READ_FAILED,
                    "Failed to walk store root " + root + ": " + e.getMessage(), e);
        }

        List<FileStatsResponse.FileStat> stats = new ArrayList<>(files.size());
        long totalRecords = 0;
        long totalBytes = 0;
        for (Path file : files) {
            FileStatsResponse.FileStat stat = describe(file);
            totalRecords += stat.getRecordsCount();
            totalBytes += stat.getSizeBytes();
            stats.add(stat);
        }

        log.debug("Inventory: {} files, {} records, {} bytes", stats.size(), totalRecords, totalBytes);
        return FileStatsResponse.builder()
                .totalFiles(stats.size())
                .totalRecords(totalRecords)
                .totalSizeBytes(totalBytes)
                .files(stats)
                .build();
    }

    private FileStatsResponse.FileStat describe(Path file) {
        try {
            BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
            return FileStatsResponse.FileStat.builder()
                    .path(layout.relativize(file))
                    .recordsCount(ParquetPartFile.countRows(file))
                    .sizeBytes(attributes.size())
                    .sizeMb(toMegabytes(attributes.size()))
                    .createdAt(attributes.creationTime().toInstant().toString())
                    .modifiedAt(attributes.lastModifiedTime().toInstant().toString())
                    .build();
        } catch (IOException | RuntimeException e) {
            throw new HealthStoreException(ErrorCode.INVENTORY_READ_FAILED,
                    "Failed to inspect " + layout.relativize(file) + ": " + e.getMessage(), e);
        }
    }

    static double toMegabytes(long bytes) {
        return BigDecimal.valueOf(bytes).divide(BYTES_PER_MB, 2, RoundingMode.HALF_UP).doubleValue();
    }
}
