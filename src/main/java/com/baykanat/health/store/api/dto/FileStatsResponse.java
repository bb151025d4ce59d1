package com.baykanat.health.store.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Store envanteri: dosya başına kayıt sayısı, boyut ve dosya sistemi zamanları. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Inventory of stored part files")
public class FileStatsResponse {

    @JsonProperty("total_files")
    @Schema(description = "Number of part files", example = "3")
    private int totalFiles;

    @JsonProperty("total_records")
    @Schema(description = "Sum of records over all files", example = "3")
    private long totalRecords;

    @JsonProperty("total_size_bytes")
    @Schema(description = "Sum of file sizes", example = "2310")
    private long totalSizeBytes;

    @JsonProperty("files")
    @Schema(description = "Per-file statistics, ordered by path")
    private List<FileStat> files;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(description = "Statistics of one part file")
    public static class FileStat {
        @Schema(description = "Path relative to the store root", example = "year=2025/month=03/day=01/part-3f0c....parquet")
        private String path;

        @JsonProperty("records_count")
        @Schema(description = "Rows in the file", example = "1")
        private long recordsCount;

        @JsonProperty("size_bytes")
        @Schema(description = "File size in bytes", example = "770")
        private long sizeBytes;

        @JsonProperty("size_mb")
        @Schema(description = "File size in MB, two decimals", example = "0.0")
        private double sizeMb;

        @JsonProperty("created_at")
        @Schema(description = "File creation time", example = "2025-03-01T08:00:01.120Z")
        private String createdAt;

        @JsonProperty("modified_at")
        @Schema(description = "Last modification time", example = "2025-03-01T08:00:01.120Z")
        private String modifiedAt;
    }
}
