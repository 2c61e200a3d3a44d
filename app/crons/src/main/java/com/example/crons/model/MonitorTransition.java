/*
 * どこで: Crons ドメインモデル
 * 何を: 閾値判定で発生した DEGRADED/RECOVERED 遷移を表す
 * なぜ: コミット後のログ/メトリクス記録に遷移内容を渡すため
 */
package com.example.crons.model;

import java.time.Instant;
import java.util.UUID;

public record MonitorTransition(
    UUID eventId,
    String monitorSlug,
    String environment,
    TransitionType transition,
    int consecutiveCount,
    Instant occurredAt) {}
