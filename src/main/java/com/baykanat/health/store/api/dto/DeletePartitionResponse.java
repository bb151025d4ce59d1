package com.baykanat.health.store.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Partition silme yanıtı. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Response for partition deletion")
public class DeletePartitionResponse {

    @Schema(description = "Status message", example = "success")
    private String status;

    @Schema(description = "Deleted partition date", example = "2025-03-01")
    private String date;

    @Schema(description = "Deleted partition key", example = "year=2025/month=03/day=01")
    private String partition;

    @JsonProperty("deleted_files")
    @Schema(description = "Number of part files removed", example = "2")
    private int deletedFiles;
}
