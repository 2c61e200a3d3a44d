package com.example.crons.schedule;

import java.time.ZoneId;
import java.util.Objects;

/** 5 フィールドの crontab 式。モニターの IANA タイムゾーンのローカル時刻で評価する。 */
public record CrontabSchedule(String expression, ZoneId zone) implements Schedule {

  public CrontabSchedule {
    Objects.requireNonNull(expression, "expression");
    Objects.requireNonNull(zone, "zone");
  }
}
