package com.baykanat.health.store.infrastructure.storage;

import com.baykanat.health.store.api.dto.PartitionDataResponse;
import com.baykanat.health.store.domain.exception.ErrorCode;
import com.baykanat.health.store.domain.exception.HealthStoreException;
import com.baykanat.health.store.domain.model.HealthRecord;
import com.baykanat.health.store.domain.model.PartitionKey;
import com.baykanat.health.store.domain.service.EventTimestamps;
import com.baykanat.health.store.domain.service.PartitionPathResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Bir günün part dosyalarını okuyup tek satır kümesinde birleştirir (merge-on-read).
 * Sütun kümesi dosyaların birleşimidir; eksik sütunlar null. Bozuk tek dosya tüm okumayı düşürür.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PartitionReader {

    private static final Comparator<Map<String, Object>> BY_EVENT_TIME = Comparator.comparing(
            PartitionReader::eventInstant, Comparator.nullsLast(Comparator.naturalOrder()));

    private final PartitionPathResolver pathResolver;
    private final StorageLayout layout;

    /** Tarih yoksa bugün. Satırlar event zamanına göre sıralanır, son {@code limit} satır döner. */
    public PartitionDataResponse read(String date, int limit) {
        PartitionKey key = pathResolver.resolve(date);
        Path dir = layout.partitionDir(key);
        String day = key.toDate().toString();

        if (!Files.isDirectory(dir)) {
            log.debug("Partition {} does not exist", key);
            return PartitionDataResponse.builder()
                    .status(PartitionDataResponse.STATUS_NOT_FOUND)
                    .date(day)
                    .totalRecords(0)
                    .returnedRecords(0)
                    .data(List.of())
                    .build();
        }

        List<Map<String, Object>> rows = merge(readAll(dir));
        rows.sort(BY_EVENT_TIME);

        int from = Math.max(0, rows.size() - Math.max(limit, 0));
        List<Map<String, Object>> tail = new ArrayList<>(rows.subList(from, rows.size()));
        log.debug("Read partition {}: {} rows, returning {}", key, rows.size(), tail.size());

        return PartitionDataResponse.builder()
                .status(PartitionDataResponse.STATUS_SUCCESS)
                .date(day)
                .totalRecords(rows.size())
                .returnedRecords(tail.size())
                .data(tail)
                .build();
    }

    /** Dizin listesi anlık görüntüdür; listelemeden sonra silinen dosya okuma hatasıdır. */
    private List<Map<String, Object>> readAll(Path dir) {
        List<Path> files;
        try (Stream<Path> listing = Files.list(dir)) {
            files = listing.filter(Files::isRegularFile).filter(layout::isPartFile).sorted().toList();
        } catch (IOException e) {
            throw new HealthStoreException(ErrorCode.PARTITION_READ_FAILED,
                    "Failed to list partition " + dir + ": " + e.getMessage(), e);
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        for (Path file : files) {
            try {
                rows.addAll(ParquetPartFile.read(file));
            } catch (IOException | RuntimeException e) {
                throw new HealthStoreException(ErrorCode.PARTITION_READ_FAILED,
                        "Failed to read part file " + layout.relativize(file) + ": " + e.getMessage(), e);
            }
        }
        return rows;
    }

    private static Instant eventInstant(Map<String, Object> row) {
        OffsetDateTime eventTime = EventTimestamps.parseOrNull(row.get(HealthRecord.TIMESTAMP));
        return eventTime != null ? eventTime.toInstant() : null;
    }

    /** Tüm satırları sütun birleşimine genişletir; olmayan alanlar açıkça null. */
    static List<Map<String, Object>> merge(List<Map<String, Object>> rows) {
        Set<String> columns = new LinkedHashSet<>();
        rows.forEach(row -> columns.addAll(row.keySet()));

        List<Map<String, Object>> merged = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> full = new LinkedHashMap<>();
            for (String column : columns) {
                full.put(column, row.get(column));
            }
            merged.add(full);
        }
        return merged;
    }
}
