/*
 * どこで: Crons ドメインモデル
 * 何を: monitor_checkins の登録用データを表す
 * なぜ: 受理したチェックインを追記専用の監査ログとして残すため
 */
package com.example.crons.model;

import java.time.Instant;
import java.util.UUID;

public record CheckInRecord(
    UUID checkinRef,
    UUID monitorId,
    String checkInId,
    CheckInStatus status,
    Double durationSeconds,
    Instant receivedAt,
    UUID runRef,
    CheckInOutcome outcome) {}
