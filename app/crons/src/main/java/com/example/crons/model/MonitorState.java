/*
 * どこで: Crons ドメインモデル
 * 何を: CAS で更新されるモニターの可変状態を表す
 * なぜ: 設定の upsert と状態遷移の書込み対象を明確に分けるため
 */
package com.example.crons.model;

import java.time.Instant;

public record MonitorState(
    MonitorStatus status,
    int consecutiveFailures,
    int consecutiveSuccesses,
    Instant lastExpectedRunAt,
    String lastRunId) {

  public static MonitorState initial() {
    return new MonitorState(MonitorStatus.UP, 0, 0, null, null);
  }

  public MonitorState withCounters(MonitorStatus nextStatus, int failures, int successes) {
    return new MonitorState(nextStatus, failures, successes, lastExpectedRunAt, lastRunId);
  }

  public MonitorState withLastExpectedRunAt(Instant expectedAt) {
    return new MonitorState(
        status, consecutiveFailures, consecutiveSuccesses, expectedAt, lastRunId);
  }

  public MonitorState withLastRunId(String runId) {
    return new MonitorState(
        status, consecutiveFailures, consecutiveSuccesses, lastExpectedRunAt, runId);
  }
}
