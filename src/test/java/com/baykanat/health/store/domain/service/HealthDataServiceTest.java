package com.baykanat.health.store.domain.service;

import com.baykanat.health.store.api.dto.DeletePartitionResponse;
import com.baykanat.health.store.api.dto.HealthDataRequest;
import com.baykanat.health.store.api.dto.IngestResponse;
import com.baykanat.health.store.api.dto.PartitionDataResponse;
import com.baykanat.health.store.config.AppProperties;
import com.baykanat.health.store.domain.exception.ErrorCode;
import com.baykanat.health.store.domain.exception.HealthStoreException;
import com.baykanat.health.store.domain.mapper.HealthRecordMapper;
import com.baykanat.health.store.domain.model.HealthRecord;
import com.baykanat.health.store.infrastructure.storage.EventWriter;
import com.baykanat.health.store.infrastructure.storage.PartitionReader;
import com.baykanat.health.store.infrastructure.storage.PartitionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for HealthDataService.
 *
 * <p>Verifies with mocked storage components:
 * <ul>
 *   <li>Request to record mapping on ingest</li>
 *   <li>Default read limit</li>
 *   <li>Date validation before any delete</li>
 * </ul>
 */
@ExtendWith(MockitoExtension.class)
class HealthDataServiceTest {

    @Mock
    private EventWriter eventWriter;

    @Mock
    private PartitionReader partitionReader;

    @Mock
    private PartitionStore partitionStore;

    @Mock
    private InventoryService inventoryService;

    private HealthDataService service;

    @BeforeEach
    void setUp() {
        HealthRecordMapper mapper = Mappers.getMapper(HealthRecordMapper.class);
        service = new HealthDataService(eventWriter, partitionReader, partitionStore, inventoryService,
                mapper, new AppProperties());
    }

    @Test
    @DisplayName("Ingest maps every request field and leaves processed_at to the writer")
    void ingestMapsRequest() {
        when(eventWriter.append(any())).thenReturn(IngestResponse.builder().status("success").build());
        HealthDataRequest request = HealthDataRequest.builder()
                .stepCount(1200.0)
                .totalSleepMinutes(400)
                .deviceId("iphone")
                .userId("u-1")
                .timestamp("2025-03-01T08:00:00Z")
                .build();

        service.ingest(request);

        ArgumentCaptor<HealthRecord> captor = ArgumentCaptor.forClass(HealthRecord.class);
        verify(eventWriter).append(captor.capture());
        HealthRecord record = captor.getValue();
        assertThat(record.getStepCount()).isEqualTo(1200.0);
        assertThat(record.getTotalSleepMinutes()).isEqualTo(400);
        assertThat(record.getDeviceId()).isEqualTo("iphone");
        assertThat(record.getUserId()).isEqualTo("u-1");
        assertThat(record.getTimestamp()).isEqualTo("2025-03-01T08:00:00Z");
        assertThat(record.getHeartRate()).isNull();
        assertThat(record.getProcessedAt()).isNull();
    }

    @Test
    @DisplayName("Read without limit uses the configured default of 100")
    void readUsesDefaultLimit() {
        when(partitionReader.read("2025-03-01", 100)).thenReturn(PartitionDataResponse.builder().build());

        service.read("2025-03-01", null);

        verify(partitionReader).read("2025-03-01", 100);
    }

    @Test
    @DisplayName("Read passes an explicit limit through")
    void readPassesLimit() {
        when(partitionReader.read(null, 5)).thenReturn(PartitionDataResponse.builder().build());

        service.read(null, 5);

        verify(partitionReader).read(null, 5);
    }

    @Test
    @DisplayName("Delete parses the date and delegates to the partition store")
    void deleteDelegates() {
        when(partitionStore.deletePartition(LocalDate.of(2025, 3, 1)))
                .thenReturn(DeletePartitionResponse.builder().status("success").deletedFiles(2).build());

        DeletePartitionResponse response = service.deletePartition("2025-03-01");

        assertThat(response.getDeletedFiles()).isEqualTo(2);
    }

    @Test
    @DisplayName("Delete rejects non-canonical or impossible dates with INVALID_DATE_FORMAT")
    void deleteRejectsBadDates() {
        for (String date : new String[]{"2025-3-1", "2025-02-30", "20250301", "latest"}) {
            assertThatThrownBy(() -> service.deletePartition(date))
                    .as(date)
                    .isInstanceOf(HealthStoreException.class)
                    .extracting("code").isEqualTo(ErrorCode.INVALID_DATE_FORMAT);
        }
        verifyNoInteractions(partitionStore);
    }
}
