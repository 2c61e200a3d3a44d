/*
 * どこで: Crons ドメインモデル
 * 何を: クライアントが送るチェックイン状態と wire 値の対応を定義する
 * なぜ: 小文字の wire 値を型安全な enum に閉じ込めるため
 */
package com.example.crons.model;

import java.util.Locale;

public enum CheckInStatus {
  IN_PROGRESS("in_progress"),
  OK("ok"),
  ERROR("error");

  private final String value;

  CheckInStatus(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public boolean isTerminal() {
    return this != IN_PROGRESS;
  }

  public RunStatus toRunStatus() {
    return switch (this) {
      case OK -> RunStatus.OK;
      case ERROR -> RunStatus.ERROR;
      case IN_PROGRESS -> throw new IllegalStateException("in_progress is not terminal");
    };
  }

  public static CheckInStatus fromValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("status is required");
    }
    final String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (CheckInStatus status : values()) {
      if (status.value.equals(normalized)) {
        return status;
      }
    }
    throw new IllegalArgumentException("unsupported status: " + value);
  }
}
