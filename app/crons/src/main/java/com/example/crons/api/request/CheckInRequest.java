/*
 * どこで: Crons API
 * 何を: チェックイン受付のリクエストボディを表す
 * なぜ: SDK が送る snake_case の JSON をそのまま受けるため
 */
package com.example.crons.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CheckInRequest(
    @NotBlank(message = "status is required") String status,
    @Size(max = 64, message = "environment must be at most 64 characters") String environment,
    @Size(max = 128, message = "check_in_id must be at most 128 characters") String checkInId,
    @PositiveOrZero(message = "duration_seconds must be >= 0")
        @DecimalMax(value = "31536000", message = "duration_seconds must be <= 31536000")
        Double durationSeconds,
    @Valid MonitorConfigRequest monitorConfig) {}
