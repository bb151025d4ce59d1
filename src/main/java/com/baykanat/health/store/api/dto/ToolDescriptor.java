package com.baykanat.health.store.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/** GET /tools listesindeki bir araç; parametreler varsayılan değerleriyle. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Query tool description")
public class ToolDescriptor {

    @Schema(description = "Tool name", example = "daily_agg")
    private String name;

    @Schema(description = "What the tool returns")
    private String description;

    @Schema(description = "Parameter names with default values (null = required)")
    private Map<String, Object> parameters;
}
