/*
 * どこで: Crons ドメインモデル
 * 何を: 取り込んだチェックインが Run に何をしたかを表す
 * なぜ: 監査ログで「受理したが反映しなかった」ケースを区別するため
 */
package com.example.crons.model;

public enum CheckInOutcome {
  STARTED,
  DUPLICATE_START,
  CLOSED,
  HEARTBEAT,
  IGNORED_TERMINAL
}
