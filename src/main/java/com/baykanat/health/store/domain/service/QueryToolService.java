package com.baykanat.health.store.domain.service;

import com.baykanat.health.store.api.dto.QueryResultResponse;
import com.baykanat.health.store.api.dto.ToolDescriptor;
import com.baykanat.health.store.config.AppProperties;
import com.baykanat.health.store.domain.exception.ErrorCode;
import com.baykanat.health.store.domain.exception.HealthStoreException;
import com.baykanat.health.store.domain.model.QueryTool;
import com.baykanat.health.store.infrastructure.query.QueryEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Araç adı + argümanları QueryTool enum'una göre QueryEngine işlemlerine yönlendirir. */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryToolService {

    private final QueryEngine queryEngine;
    private final AppProperties appProperties;

    public List<ToolDescriptor> listTools() {
        return Arrays.stream(QueryTool.values())
                .map(tool -> ToolDescriptor.builder()
                        .name(tool.toolName())
                        .description(tool.description())
                        .parameters(parameters(tool))
                        .build())
                .toList();
    }

    /** Bilinmeyen araç UNKNOWN_TOOL, eksik/geçersiz argüman INVALID_TOOL_ARGUMENTS. */
    public QueryResultResponse invoke(String toolName, Map<String, Object> arguments) {
        QueryTool tool = QueryTool.fromToolName(toolName)
                .orElseThrow(() -> new HealthStoreException(ErrorCode.UNKNOWN_TOOL, "Unknown tool: " + toolName));
        Map<String, Object> args = arguments != null ? arguments : Map.of();
        AppProperties.QueryProperties defaults = appProperties.getQuery();

        log.debug("Invoking tool {} with arguments {}", tool.toolName(), args.keySet());
        return switch (tool) {
            case QUERY_DUCKDB -> queryEngine.runSql(
                    requiredString(args, "sql"),
                    intArgument(args, "limit", defaults.getDefaultLimit(), 1));
            case DAILY_AGG -> queryEngine.dailyAggregate(
                    intArgument(args, "days", defaults.getDefaultDays(), 0));
            case RECENT_RAW -> queryEngine.recentRaw(
                    intArgument(args, "limit", defaults.getRecentLimit(), 1));
        };
    }

    private Map<String, Object> parameters(QueryTool tool) {
        AppProperties.QueryProperties defaults = appProperties.getQuery();
        Map<String, Object> parameters = new LinkedHashMap<>();
        switch (tool) {
            case QUERY_DUCKDB -> {
                parameters.put("sql", null);
                parameters.put("limit", defaults.getDefaultLimit());
            }
            case DAILY_AGG -> parameters.put("days", defaults.getDefaultDays());
            case RECENT_RAW -> parameters.put("limit", defaults.getRecentLimit());
        }
        return parameters;
    }

    private static String requiredString(Map<String, Object> args, String name) {
        Object value = args.get(name);
        if (!(value instanceof String text) || text.isBlank()) {
            throw invalidArgument(name, "is required and must be a non-empty string");
        }
        return text;
    }

    private static int intArgument(Map<String, Object> args, String name, int defaultValue, int min) {
        Object value = args.get(name);
        if (value == null) {
            return defaultValue;
        }
        int parsed;
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            long number = ((Number) value).longValue();
            if (number > Integer.MAX_VALUE || number < Integer.MIN_VALUE) {
                throw invalidArgument(name, "is out of range");
            }
            parsed = (int) number;
        } else if (value instanceof String text) {
            try {
                parsed = Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                throw invalidArgument(name, "must be an integer");
            }
        } else {
            throw invalidArgument(name, "must be an integer");
        }
        if (parsed < min) {
            throw invalidArgument(name, "must be >= " + min);
        }
        return parsed;
    }

    private static HealthStoreException invalidArgument(String name, String reason) {
        return new HealthStoreException(ErrorCode.INVALID_TOOL_ARGUMENTS, "Argument '" + name + "' " + reason);
    }
}
