/*
 * どこで: Crons ドメインモデル
 * 何を: monitor_runs テーブルの 1 行 (1 回の予定実行) を表す
 * なぜ: 開始/終端の first-writer-wins 判定を呼び出し側で読めるようにするため
 */
package com.example.crons.model;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

public record RunRecord(
    UUID runRef,
    UUID monitorId,
    String runId,
    Instant expectedAt,
    Instant startedAt,
    Instant finishedAt,
    RunStatus terminalStatus,
    int checkinMarginMinutes,
    int maxRuntimeMinutes) {

  public boolean isTerminal() {
    return terminalStatus != null;
  }

  public boolean isOpen() {
    return startedAt != null && terminalStatus == null;
  }

  // max_runtime = 0 は無制限としてタイムアウトさせない
  public boolean isOverdue(Instant now) {
    if (!isOpen() || maxRuntimeMinutes <= 0) {
      return false;
    }
    return now.isAfter(startedAt.plus(Duration.ofMinutes(maxRuntimeMinutes)));
  }
}
