package com.baykanat.health.store.infrastructure.storage;

import com.baykanat.health.store.config.AppProperties;
import com.baykanat.health.store.domain.model.PartitionKey;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;

/** Disk yerleşimi: {@code <root>/year=YYYY/month=MM/day=DD/part-<uuid>.parquet}. */
@Component
public class StorageLayout {

    public static final String PART_PREFIX = "part-";
    public static final String PART_EXTENSION = ".parquet";

    private final Path root;

    public StorageLayout(AppProperties appProperties) {
        this.root = Paths.get(appProperties.getStorage().getRoot());
    }

    public Path root() {
        return root;
    }

    public Path partitionDir(PartitionKey key) {
        return root.resolve(key.path());
    }

    /** Yeni, çakışmasız part dosyası yolu; dosya henüz oluşturulmaz. */
    public Path newPartFile(PartitionKey key) {
        return partitionDir(key).resolve(PART_PREFIX + UUID.randomUUID() + PART_EXTENSION);
    }

    public boolean isPartFile(Path path) {
        return path.getFileName().toString().endsWith(PART_EXTENSION);
    }

    /** Köke göreli, '/' ayraçlı yol. */
    public String relativize(Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }

    /** DuckDB read_parquet için tüm partition'ları kapsayan glob. */
    public String defaultGlob() {
        String base = root.toAbsolutePath().normalize().toString().replace('\\', '/');
        return base + "/year=*/month=*/day=*/*" + PART_EXTENSION;
    }
}
