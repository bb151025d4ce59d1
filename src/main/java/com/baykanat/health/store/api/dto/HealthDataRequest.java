package com.baykanat.health.store.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Cihazdan gelen ölçüm payload'ı; timestamp dışındaki tüm alanlar opsiyonel. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Health measurement event")
public class HealthDataRequest {

    @PositiveOrZero(message = "stepCount must not be negative")
    @Schema(description = "Step count", example = "1200")
    private Double stepCount;

    @PositiveOrZero(message = "heartRate must not be negative")
    @Schema(description = "Heart rate (bpm)", example = "72")
    private Double heartRate;

    @PositiveOrZero(message = "activeEnergyBurned must not be negative")
    @Schema(description = "Active energy burned (kcal)", example = "35.5")
    private Double activeEnergyBurned;

    @PositiveOrZero(message = "distanceWalkingRunning must not be negative")
    @Schema(description = "Walking + running distance (m)", example = "840")
    private Double distanceWalkingRunning;

    @PositiveOrZero(message = "bodyMass must not be negative")
    @Schema(description = "Body mass (kg)", example = "71.3")
    private Double bodyMass;

    @PositiveOrZero(message = "height must not be negative")
    @Schema(description = "Height (m)", example = "1.78")
    private Double height;

    @PositiveOrZero(message = "mindfulMinutes must not be negative")
    @Schema(description = "Mindful minutes", example = "10")
    private Double mindfulMinutes;

    @PositiveOrZero(message = "totalSleepMinutes must not be negative")
    @Schema(description = "Total sleep minutes", example = "420")
    private Integer totalSleepMinutes;

    @NotBlank(message = "timestamp is required")
    @Schema(description = "Event time, ISO-8601 with offset or 'Z'", example = "2025-03-01T08:00:00Z")
    private String timestamp;

    @Schema(description = "Source device identifier", example = "iphone-15")
    private String deviceId;

    @Schema(description = "User identifier", example = "user_123")
    private String userId;
}
