/*
 * どこで: Crons スケジュール評価
 * 何を: interval スケジュールの単位と wire 値の対応を定義する
 * なぜ: 分/時は固定長、日以上は暦の加算として扱いを分けるため
 */
package com.example.crons.schedule;

import java.time.temporal.ChronoUnit;
import java.util.Locale;

public enum IntervalUnit {
  MINUTE("minute", ChronoUnit.MINUTES, true),
  HOUR("hour", ChronoUnit.HOURS, true),
  DAY("day", ChronoUnit.DAYS, false),
  WEEK("week", ChronoUnit.WEEKS, false),
  MONTH("month", ChronoUnit.MONTHS, false),
  YEAR("year", ChronoUnit.YEARS, false);

  private final String value;
  private final ChronoUnit chronoUnit;
  private final boolean fixedLength;

  IntervalUnit(String value, ChronoUnit chronoUnit, boolean fixedLength) {
    this.value = value;
    this.chronoUnit = chronoUnit;
    this.fixedLength = fixedLength;
  }

  public String value() {
    return value;
  }

  public ChronoUnit chronoUnit() {
    return chronoUnit;
  }

  // 日以上はタイムゾーン上の暦加算になるため、DST をまたぐと実時間は一定でない
  public boolean isFixedLength() {
    return fixedLength;
  }

  public static IntervalUnit fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new InvalidScheduleException("interval unit is required");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if (normalized.endsWith("s")) {
      normalized = normalized.substring(0, normalized.length() - 1);
    }
    for (IntervalUnit unit : values()) {
      if (unit.value.equals(normalized)) {
        return unit;
      }
    }
    throw new InvalidScheduleException("unsupported interval unit: " + value);
  }
}
