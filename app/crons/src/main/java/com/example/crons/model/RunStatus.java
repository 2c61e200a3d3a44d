/*
 * どこで: Crons ドメインモデル
 * 何を: Run の終端状態を定義する
 * なぜ: チェックインとスイープのどちらが書いた終端かを同じ型で扱うため
 */
package com.example.crons.model;

public enum RunStatus {
  OK,
  ERROR,
  MISSED,
  TIMEOUT;

  public boolean isFailure() {
    return this != OK;
  }
}
