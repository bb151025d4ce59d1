package com.baykanat.health.store.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/** Sorgu aracı sonucu: satır tablosu + satır sayısı. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Tabular query result")
public class QueryResultResponse {

    @Schema(description = "Result rows, column name to value")
    private List<Map<String, Object>> rows;

    @JsonProperty("row_count")
    @Schema(description = "Number of rows returned", example = "2")
    private int rowCount;

    public static QueryResultResponse of(List<Map<String, Object>> rows) {
        return new QueryResultResponse(rows, rows.size());
    }
}
