package com.baykanat.health.store.infrastructure.storage;

import com.baykanat.health.store.api.dto.DeletePartitionResponse;
import com.baykanat.health.store.domain.exception.ErrorCode;
import com.baykanat.health.store.domain.exception.HealthStoreException;
import com.baykanat.health.store.domain.model.PartitionKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.stream.Stream;

/** Partition düzeyinde silme; tek dosya silme yok. Eşzamanlı okuyuculara karşı atomik değil. */
@Slf4j
@Component
@RequiredArgsConstructor
public class PartitionStore {

    private final StorageLayout layout;

    /** Günün tüm dizinini siler; dizin yoksa PARTITION_NOT_FOUND. */
    public DeletePartitionResponse deletePartition(LocalDate date) {
        PartitionKey key = PartitionKey.of(date);
        Path dir = layout.partitionDir(key);
        if (!Files.isDirectory(dir)) {
            throw HealthStoreException.partitionNotFound(date.toString());
        }

        int deleted;
        boolean removed;
        try {
            deleted = countPartFiles(dir);
            removed = FileSystemUtils.deleteRecursively(dir);
        } catch (NoSuchFileException e) {
            throw HealthStoreException.partitionNotFound(date.toString());
        } catch (IOException e) {
            throw new HealthStoreException(ErrorCode.STORAGE_WRITE_FAILED,
                    "Failed to delete partition " + key + ": " + e.getMessage(), e);
        }
        // Kontrol ile silme arasında başka bir istek dizini kaldırmış olabilir.
        if (!removed) {
            throw HealthStoreException.partitionNotFound(date.toString());
        }

        log.info("Deleted partition {} ({} files)", key, deleted);
        return DeletePartitionResponse.builder()
                .status("success")
                .date(date.toString())
                .partition(key.path())
                .deletedFiles(deleted)
                .build();
    }

    private int countPartFiles(Path dir) throws IOException {
        try (Stream<Path> listing = Files.list(dir)) {
            return (int) listing.filter(layout::isPartFile).count();
        }
    }
}
