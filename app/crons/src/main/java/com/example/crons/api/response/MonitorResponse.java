/*
 * どこで: Crons API
 * 何を: モニターの設定と現在状態の参照レスポンスを表す
 * なぜ: SDK と運用者が閾値判定の進み具合を確認できるようにするため
 */
package com.example.crons.api.response;

import com.example.crons.api.request.ScheduleRequest;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MonitorResponse(
    String slug,
    String environment,
    ScheduleRequest schedule,
    String timezone,
    int checkinMargin,
    int maxRuntime,
    int failureIssueThreshold,
    int recoveryThreshold,
    String status,
    int consecutiveFailures,
    int consecutiveSuccesses,
    Instant lastExpectedRunAt,
    String lastRunId,
    Instant createdAt,
    Instant updatedAt) {}
