/*
 * どこで: Crons スケジュール評価
 * 何を: crontab / interval の 2 形式をタグ付きの型として表す
 * なぜ: 評価器が型で分岐でき、緩い Map 形式の設定を持ち込まないため
 */
package com.example.crons.schedule;

import java.time.ZoneId;

public interface Schedule {

  ZoneId zone();
}
