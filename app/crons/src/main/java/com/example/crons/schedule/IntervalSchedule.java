package com.example.crons.schedule;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * 起点 {@code anchor} から {@code value * unit} ごとの予定実行。
 *
 * <p>N 回目は常に {@code anchor + N * interval} で求め、前回実行からの加算はしない。
 */
public record IntervalSchedule(int value, IntervalUnit unit, ZoneId zone, Instant anchor)
    implements Schedule {

  public IntervalSchedule {
    if (value < 1) {
      throw new IllegalArgumentException("interval value must be >= 1");
    }
    Objects.requireNonNull(unit, "unit");
    Objects.requireNonNull(zone, "zone");
    Objects.requireNonNull(anchor, "anchor");
  }
}
