package com.baykanat.health.store.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/** Tek ölçüm event'i; her part dosyası bir kayıt taşır. Ölçüm alanlarının hepsi opsiyonel. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class HealthRecord {

    public static final String TIMESTAMP = "timestamp";
    public static final String PROCESSED_AT = "processed_at";

    private Double stepCount;
    private Double heartRate;
    private Double activeEnergyBurned;
    private Double distanceWalkingRunning;
    private Double bodyMass;
    private Double height;
    private Double mindfulMinutes;
    private Integer totalSleepMinutes;
    private String timestamp;
    private String deviceId;
    private String userId;
    private String processedAt;

    /** Null olmayan alanlar, Parquet sütun adıyla; dosya şeması bu sütunlardan oluşur. */
    public Map<String, Object> columns() {
        Map<String, Object> columns = new LinkedHashMap<>();
        put(columns, "stepCount", stepCount);
        put(columns, "heartRate", heartRate);
        put(columns, "activeEnergyBurned", activeEnergyBurned);
        put(columns, "distanceWalkingRunning", distanceWalkingRunning);
        put(columns, "bodyMass", bodyMass);
        put(columns, "height", height);
        put(columns, "mindfulMinutes", mindfulMinutes);
        put(columns, "totalSleepMinutes", totalSleepMinutes);
        put(columns, TIMESTAMP, timestamp);
        put(columns, "deviceId", deviceId);
        put(columns, "userId", userId);
        put(columns, PROCESSED_AT, processedAt);
        return columns;
    }

    private static void put(Map<String, Object> columns, String name, Object value) {
        if (value != null) {
            columns.put(name, value);
        }
    }
}
