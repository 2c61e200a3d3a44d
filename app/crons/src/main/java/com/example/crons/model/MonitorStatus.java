/*
 * どこで: Crons ドメインモデル
 * 何を: モニターのアラート状態を定義する
 * なぜ: 閾値判定の結果を DB の CHECK 制約と一致させるため
 */
package com.example.crons.model;

public enum MonitorStatus {
  UP,
  DOWN
}
