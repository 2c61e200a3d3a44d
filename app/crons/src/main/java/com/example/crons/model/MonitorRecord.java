/*
 * どこで: Crons ドメインモデル
 * 何を: monitors テーブルのスナップショットを表す
 * なぜ: version を CAS の期待値として持ち回るため
 */
package com.example.crons.model;

import com.example.crons.schedule.Schedule;
import java.time.Instant;
import java.util.UUID;

public record MonitorRecord(
    UUID monitorId,
    String slug,
    String environment,
    MonitorConfig config,
    MonitorState state,
    long version,
    Instant createdAt,
    Instant updatedAt) {

  public Schedule schedule() {
    return config.toSchedule(createdAt);
  }
}
