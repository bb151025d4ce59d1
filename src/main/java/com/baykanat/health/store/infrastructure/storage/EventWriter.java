package com.baykanat.health.store.infrastructure.storage;

import com.baykanat.health.store.api.dto.IngestResponse;
import com.baykanat.health.store.config.AppProperties;
import com.baykanat.health.store.domain.exception.ErrorCode;
import com.baykanat.health.store.domain.exception.HealthStoreException;
import com.baykanat.health.store.domain.model.HealthRecord;
import com.baykanat.health.store.domain.model.PartitionKey;
import com.baykanat.health.store.domain.service.EventTimestamps;
import com.baykanat.health.store.domain.service.PartitionPathResolver;
import lombok.extern.slf4j.Slf4j;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Locale;

/** Her event'i kendi timestamp'inin günündeki partition'a yeni, değişmez bir Parquet dosyası olarak yazar. */
@Slf4j
@Component
public class EventWriter {

    private final PartitionPathResolver pathResolver;
    private final StorageLayout layout;
    private final Clock clock;
    private final CompressionCodecName compression;

    public EventWriter(PartitionPathResolver pathResolver, StorageLayout layout, Clock clock,
                       AppProperties appProperties) {
        this.pathResolver = pathResolver;
        this.layout = layout;
        this.clock = clock;
        this.compression = CompressionCodecName.valueOf(
                appProperties.getStorage().getCompression().trim().toUpperCase(Locale.ROOT));
    }

    /** Timestamp doğrulanır (I/O'dan önce), processed_at damgalanır, tek kayıtlık dosya yazılır. */
    public IngestResponse append(HealthRecord record) {
        OffsetDateTime eventTime = EventTimestamps.parse(record.getTimestamp());
        PartitionKey key = pathResolver.resolve(eventTime.toLocalDate());

        HealthRecord stamped = record.toBuilder()
                .processedAt(OffsetDateTime.now(clock).toString())
                .build();

        Path file = layout.newPartFile(key);
        try {
            Files.createDirectories(file.getParent());
        } catch (IOException e) {
            throw writeFailed(file, e);
        }
        try {
            ParquetPartFile.write(file, stamped.columns(), compression);
        } catch (FileAlreadyExistsException e) {
            // Dosya bu çağrıya ait değil; silinmez.
            throw writeFailed(file, e);
        } catch (IOException | RuntimeException e) {
            discardPartial(file, e);
            throw writeFailed(file, e);
        }

        log.info("Stored event: partition={}, file={}", key, file.getFileName());
        return IngestResponse.builder()
                .status("success")
                .filePath(file.toString())
                .partition(key.path())
                .recordsWritten(1)
                .build();
    }

    /** Yarım kalan dosyayı siler; silme de başarısızsa asıl hataya eklenir. */
    private void discardPartial(Path file, Exception failure) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    private static HealthStoreException writeFailed(Path file, Exception cause) {
        return new HealthStoreException(ErrorCode.STORAGE_WRITE_FAILED,
                "Failed to write " + file + ": " + cause.getMessage(), cause);
    }
}
