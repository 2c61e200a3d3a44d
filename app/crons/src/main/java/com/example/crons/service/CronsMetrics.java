/*
 * どこで: Crons サービス層
 * 何を: チェックイン/遷移/スイープ/outbox のアプリ固有メトリクス記録を集約する
 * なぜ: 取り込み結果と検出遅延、配信失敗を運用で継続監視できるようにするため
 */
package com.example.crons.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class CronsMetrics {

  private static final String METRIC_CHECKIN_TOTAL = "crons.checkin.total";
  private static final String METRIC_TRANSITION_TOTAL = "crons.transition.total";
  private static final String METRIC_SWEEP_DURATION = "crons.sweep.duration";
  private static final String METRIC_SWEEP_DETECTED = "crons.sweep.detected";
  private static final String METRIC_SWEEP_MONITOR_FAILED = "crons.sweep.monitor.failed";
  private static final String METRIC_OUTBOX_PUBLISH_DELAY = "crons.outbox.publish.delay";
  private static final String METRIC_OUTBOX_FAILED_CURRENT = "crons.outbox.failed.current";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger outboxFailedCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Timer sweepDurationTimer;
  private final Timer outboxPublishDelayTimer;

  public CronsMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_OUTBOX_FAILED_CURRENT, outboxFailedCurrent, AtomicInteger::get)
        .description("Current number of FAILED transition outbox events")
        .register(meterRegistry);
    this.sweepDurationTimer =
        Timer.builder(METRIC_SWEEP_DURATION)
            .description("Duration of one sweep pass over all monitors")
            .register(meterRegistry);
    this.outboxPublishDelayTimer =
        Timer.builder(METRIC_OUTBOX_PUBLISH_DELAY)
            .description("Delay from transition to publish completion")
            .register(meterRegistry);
  }

  public void recordCheckIn(String status, String result) {
    counter(METRIC_CHECKIN_TOTAL, "Check-ins by status and result", "status", status, "result", result)
        .increment();
  }

  public void recordTransition(String transition) {
    counter(METRIC_TRANSITION_TOTAL, "Monitor status transitions", "transition", transition)
        .increment();
  }

  public void recordSweepDetected(String kind, int count) {
    if (count <= 0) {
      return;
    }
    counter(METRIC_SWEEP_DETECTED, "Runs closed by the sweep", "kind", kind).increment(count);
  }

  public void recordSweepMonitorFailure() {
    counter(METRIC_SWEEP_MONITOR_FAILED, "Monitors skipped by the sweep after an error")
        .increment();
  }

  public void recordSweepDuration(Duration duration) {
    sweepDurationTimer.record(duration);
  }

  public void recordOutboxPublishDelay(Instant occurredAt, Instant publishedAt) {
    if (occurredAt == null || publishedAt == null || publishedAt.isBefore(occurredAt)) {
      return;
    }
    outboxPublishDelayTimer.record(Duration.between(occurredAt, publishedAt));
  }

  public void updateOutboxFailedCurrent(int failedCount) {
    outboxFailedCurrent.set(Math.max(failedCount, 0));
  }

  private Counter counter(String name, String description, String... tagKeyValues) {
    final String key = name + ":" + String.join(":", tagKeyValues);
    return counters.computeIfAbsent(
        key,
        ignored ->
            Counter.builder(name)
                .description(description)
                .tags(Tags.of(tagKeyValues))
                .register(meterRegistry));
  }
}
