package com.example.crons.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

/** 省略した項目はサーバ側の既定値で補う。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MonitorConfigRequest(
    @NotNull(message = "monitor_config.schedule is required") @Valid ScheduleRequest schedule,
    String timezone,
    @PositiveOrZero(message = "checkin_margin must be >= 0") Integer checkinMargin,
    @PositiveOrZero(message = "max_runtime must be >= 0") Integer maxRuntime,
    @Positive(message = "failure_issue_threshold must be >= 1") Integer failureIssueThreshold,
    @Positive(message = "recovery_threshold must be >= 1") Integer recoveryThreshold) {}
