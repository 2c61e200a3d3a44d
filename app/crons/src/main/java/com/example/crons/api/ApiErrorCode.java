/*
 * どこで: Crons API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.crons.api;

public enum ApiErrorCode {
  VALIDATION_ERROR,
  MONITOR_NOT_FOUND,
  CONFLICT,
  RATE_LIMITED,
  STORE_UNAVAILABLE,
  DEADLINE_EXCEEDED
}
