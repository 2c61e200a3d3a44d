/*
 * どこで: Crons サービス層
 * 何を: monitor_config リクエストに既定値を補い、検証済みの MonitorConfig を組み立てる
 * なぜ: 不正なスケジュールやタイムゾーンを保存前に 400 で弾くため
 */
package com.example.crons.service;

import com.example.crons.api.InvalidMonitorConfigException;
import com.example.crons.api.request.CrontabScheduleRequest;
import com.example.crons.api.request.IntervalScheduleRequest;
import com.example.crons.api.request.MonitorConfigRequest;
import com.example.crons.api.request.ScheduleRequest;
import com.example.crons.config.CronsMonitorDefaultsProperties;
import com.example.crons.model.MonitorConfig;
import com.example.crons.schedule.IntervalUnit;
import com.example.crons.schedule.InvalidScheduleException;
import com.example.crons.schedule.ScheduleEvaluator;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class MonitorConfigFactory {

  private final CronsMonitorDefaultsProperties defaults;
  private final ScheduleEvaluator scheduleEvaluator;
  private final Clock clock;

  public MonitorConfig create(MonitorConfigRequest request) {
    if (request.schedule() == null) {
      throw new InvalidMonitorConfigException("monitor_config.schedule is required");
    }
    final ZoneId timezone = resolveTimezone(request.timezone());
    final int checkinMargin = orDefault(request.checkinMargin(), defaults.checkinMargin());
    final int maxRuntime = orDefault(request.maxRuntime(), defaults.maxRuntime());
    final int failureThreshold =
        orDefault(request.failureIssueThreshold(), defaults.failureThreshold());
    final int recoveryThreshold =
        orDefault(request.recoveryThreshold(), defaults.recoveryThreshold());
    requireAtLeast(checkinMargin, 0, "checkin_margin");
    requireAtLeast(maxRuntime, 0, "max_runtime");
    requireAtLeast(failureThreshold, 1, "failure_issue_threshold");
    requireAtLeast(recoveryThreshold, 1, "recovery_threshold");

    final MonitorConfig config;
    try {
      config =
          toConfig(
              request.schedule(),
              timezone,
              checkinMargin,
              maxRuntime,
              failureThreshold,
              recoveryThreshold);
      // 一度も発火しない式 (例: 2 月 30 日) はスイープできないため受け付けない
      final Instant now = Instant.now(clock);
      scheduleEvaluator.nextExpected(config.toSchedule(now), now);
    } catch (InvalidScheduleException ex) {
      throw new InvalidMonitorConfigException(ex.getMessage(), ex);
    }
    return config;
  }

  private MonitorConfig toConfig(
      ScheduleRequest schedule,
      ZoneId timezone,
      int checkinMargin,
      int maxRuntime,
      int failureThreshold,
      int recoveryThreshold) {
    if (schedule instanceof CrontabScheduleRequest crontab) {
      ScheduleEvaluator.parseCrontab(crontab.value());
      return MonitorConfig.crontab(
          normalizeCrontab(crontab.value()),
          timezone,
          checkinMargin,
          maxRuntime,
          failureThreshold,
          recoveryThreshold);
    }
    if (schedule instanceof IntervalScheduleRequest interval) {
      if (interval.value() == null || interval.value() < 1) {
        throw new InvalidScheduleException("interval schedule value must be >= 1");
      }
      return MonitorConfig.interval(
          interval.value(),
          IntervalUnit.fromValue(interval.unit()),
          timezone,
          checkinMargin,
          maxRuntime,
          failureThreshold,
          recoveryThreshold);
    }
    throw new InvalidScheduleException("unsupported schedule type");
  }

  private ZoneId resolveTimezone(String timezone) {
    final String candidate =
        timezone == null || timezone.isBlank() ? defaults.timezone() : timezone.trim();
    try {
      return ZoneId.of(candidate);
    } catch (DateTimeException ex) {
      throw new InvalidMonitorConfigException("unknown timezone: " + candidate, ex);
    }
  }

  // 空白の揺れだけで設定変更扱い (version 更新) にならないよう正規化して保存する
  private String normalizeCrontab(String expression) {
    return String.join(" ", expression.trim().split("\\s+"));
  }

  private int orDefault(Integer value, int defaultValue) {
    return value == null ? defaultValue : value;
  }

  private void requireAtLeast(int value, int min, String field) {
    if (value < min) {
      throw new InvalidMonitorConfigException(field + " must be >= " + min);
    }
  }
}
