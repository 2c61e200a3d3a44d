/*
 * どこで: Crons transition outbox の状態管理
 * 何を: transition_outbox.status の有効値を enum で表現する
 * なぜ: レイヤ内で不正な状態値を防ぐため
 */
package com.example.crons.model;

public enum OutboxStatus {
  PENDING,
  IN_FLIGHT,
  PUBLISHED,
  FAILED
}
