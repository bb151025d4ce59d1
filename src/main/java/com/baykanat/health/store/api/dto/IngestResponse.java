package com.baykanat.health.store.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Ingestion yanıtı: yazılan part dosyası ve kayıt sayısı (her zaman 1). */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Response for event ingestion")
public class IngestResponse {

    @Schema(description = "Status message", example = "success")
    private String status;

    @JsonProperty("file_path")
    @Schema(description = "Written part file", example = "data/year=2025/month=03/day=01/part-3f0c....parquet")
    private String filePath;

    @JsonProperty("partition")
    @Schema(description = "Partition key", example = "year=2025/month=03/day=01")
    private String partition;

    @JsonProperty("records_written")
    @Schema(description = "Number of records written", example = "1")
    private int recordsWritten;
}
