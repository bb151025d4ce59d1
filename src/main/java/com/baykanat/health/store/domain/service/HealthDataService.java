package com.baykanat.health.store.domain.service;

import com.baykanat.health.store.api.dto.DeletePartitionResponse;
import com.baykanat.health.store.api.dto.FileStatsResponse;
import com.baykanat.health.store.api.dto.HealthDataRequest;
import com.baykanat.health.store.api.dto.IngestResponse;
import com.baykanat.health.store.api.dto.PartitionDataResponse;
import com.baykanat.health.store.config.AppProperties;
import com.baykanat.health.store.domain.exception.HealthStoreException;
import com.baykanat.health.store.domain.mapper.HealthRecordMapper;
import com.baykanat.health.store.infrastructure.storage.EventWriter;
import com.baykanat.health.store.infrastructure.storage.PartitionReader;
import com.baykanat.health.store.infrastructure.storage.PartitionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.regex.Pattern;

/** HTTP sınırının çağırdığı store işlemleri: ingest, günlük okuma, envanter, partition silme. */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthDataService {

    private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

    private final EventWriter eventWriter;
    private final PartitionReader partitionReader;
    private final PartitionStore partitionStore;
    private final InventoryService inventoryService;
    private final HealthRecordMapper healthRecordMapper;
    private final AppProperties appProperties;

    public IngestResponse ingest(HealthDataRequest request) {
        log.debug("Ingesting event with timestamp={}, deviceId={}", request.getTimestamp(), request.getDeviceId());
        return eventWriter.append(healthRecordMapper.toRecord(request));
    }

    /** limit null ise app.reader.default-limit. */
    public PartitionDataResponse read(String date, Integer limit) {
        int effectiveLimit = limit != null ? limit : appProperties.getReader().getDefaultLimit();
        return partitionReader.read(date, effectiveLimit);
    }

    public FileStatsResponse fileStats() {
        return inventoryService.stats();
    }

    /** Biçim I/O'dan önce doğrulanır: INVALID_DATE_FORMAT, ardından PARTITION_NOT_FOUND. */
    public DeletePartitionResponse deletePartition(String date) {
        if (date == null || !ISO_DATE.matcher(date).matches()) {
            throw HealthStoreException.invalidDateFormat(String.valueOf(date));
        }
        LocalDate day;
        try {
            day = LocalDate.parse(date, PartitionPathResolver.DATE_FORMAT);
        } catch (DateTimeException e) {
            throw HealthStoreException.invalidDateFormat(date);
        }
        return partitionStore.deletePartition(day);
    }
}
