/*
 * どこで: Crons ドメインモデル
 * 何を: upsert で上書きされるモニター設定を表す
 * なぜ: カウンタ/状態と設定を型で分離し、upsert が状態に触れないことを保証するため
 */
package com.example.crons.model;

import com.example.crons.schedule.CrontabSchedule;
import com.example.crons.schedule.IntervalSchedule;
import com.example.crons.schedule.IntervalUnit;
import com.example.crons.schedule.Schedule;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

public record MonitorConfig(
    ScheduleType scheduleType,
    String crontab,
    Integer intervalValue,
    IntervalUnit intervalUnit,
    ZoneId timezone,
    int checkinMarginMinutes,
    int maxRuntimeMinutes,
    int failureThreshold,
    int recoveryThreshold) {

  public static MonitorConfig crontab(
      String expression,
      ZoneId timezone,
      int checkinMarginMinutes,
      int maxRuntimeMinutes,
      int failureThreshold,
      int recoveryThreshold) {
    return new MonitorConfig(
        ScheduleType.CRONTAB,
        expression,
        null,
        null,
        timezone,
        checkinMarginMinutes,
        maxRuntimeMinutes,
        failureThreshold,
        recoveryThreshold);
  }

  public static MonitorConfig interval(
      int value,
      IntervalUnit unit,
      ZoneId timezone,
      int checkinMarginMinutes,
      int maxRuntimeMinutes,
      int failureThreshold,
      int recoveryThreshold) {
    return new MonitorConfig(
        ScheduleType.INTERVAL,
        null,
        value,
        unit,
        timezone,
        checkinMarginMinutes,
        maxRuntimeMinutes,
        failureThreshold,
        recoveryThreshold);
  }

  // interval の起点はモニター作成時刻。設定そのものは起点を持たない
  public Schedule toSchedule(Instant anchor) {
    return switch (scheduleType) {
      case CRONTAB -> new CrontabSchedule(crontab, timezone);
      case INTERVAL -> new IntervalSchedule(intervalValue, intervalUnit, timezone, anchor);
    };
  }

  public Duration checkinMargin() {
    return Duration.ofMinutes(checkinMarginMinutes);
  }
}
