package com.baykanat.health.store.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/** Tek günlük partition okuma sonucu; partition yoksa status=not_found ve boş data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Records of one daily partition")
public class PartitionDataResponse {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_NOT_FOUND = "not_found";

    @Schema(description = "success or not_found", example = "success")
    private String status;

    @Schema(description = "Partition date", example = "2025-03-01")
    private String date;

    @JsonProperty("total_records")
    @Schema(description = "Rows in the partition", example = "42")
    private int totalRecords;

    @JsonProperty("returned_records")
    @Schema(description = "Rows returned after limit", example = "10")
    private int returnedRecords;

    @Schema(description = "Rows; every observed column present, absent values null")
    private List<Map<String, Object>> data;
}
