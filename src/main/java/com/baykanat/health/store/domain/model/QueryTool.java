package com.baykanat.health.store.domain.model;

import java.util.Arrays;
import java.util.Optional;

/** Dış araç sınırına açılan kapalı sorgu aracı kümesi. */
public enum QueryTool {

    QUERY_DUCKDB("query_duckdb",
            "Run an arbitrary SQL query over health_data / health_data_norm and return the first N rows"),
    DAILY_AGG("daily_agg",
            "Per-day totals of steps, kcal, meters, mindful minutes and sleep minutes"),
    RECENT_RAW("recent_raw",
            "Raw records of the current day, earliest first (for debugging)");

    private final String toolName;
    private final String description;

    QueryTool(String toolName, String description) {
        this.toolName = toolName;
        this.description = description;
    }

    public String toolName() {
        return toolName;
    }

    public String description() {
        return description;
    }

    public static Optional<QueryTool> fromToolName(String name) {
        return Arrays.stream(values())
                .filter(tool -> tool.toolName.equals(name))
                .findFirst();
    }
}
