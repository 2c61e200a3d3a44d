/*
 * どこで: Crons メトリクステスト
 * 何を: チェックイン/遷移/スイープ/outbox 系メトリクスが記録されることを検証する
 * なぜ: 検出遅延と配信失敗の計測回帰を防ぐため
 */
package com.example.crons.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class CronsMetricsTest {

  @Test
  void recordsCheckInTransitionAndOutboxMetrics() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final CronsMetrics metrics = new CronsMetrics(registry);

    final Instant occurredAt = Instant.parse("2024-01-10T02:11:00Z");
    final Instant publishedAt = Instant.parse("2024-01-10T02:11:05Z");

    metrics.recordCheckIn("ok", "accepted");
    metrics.recordCheckIn("ok", "accepted");
    metrics.recordTransition("DEGRADED");
    metrics.recordOutboxPublishDelay(occurredAt, publishedAt);
    metrics.updateOutboxFailedCurrent(3);

    final Counter checkIns =
        registry.get("crons.checkin.total").tag("status", "ok").tag("result", "accepted").counter();
    final Counter transitions =
        registry.get("crons.transition.total").tag("transition", "DEGRADED").counter();
    final Timer delay = registry.get("crons.outbox.publish.delay").timer();
    final Gauge failed = registry.get("crons.outbox.failed.current").gauge();

    assertThat(checkIns.count()).isEqualTo(2.0d);
    assertThat(transitions.count()).isEqualTo(1.0d);
    assertThat(delay.count()).isEqualTo(1L);
    assertThat(failed.value()).isEqualTo(3.0d);
  }

  @Test
  void recordsSweepMetricsAndIgnoresEmptyDetections() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final CronsMetrics metrics = new CronsMetrics(registry);

    metrics.recordSweepDetected("missed", 4);
    metrics.recordSweepDetected("timeout", 0);
    metrics.recordSweepMonitorFailure();
    metrics.recordSweepDuration(Duration.ofMillis(120));
    // 発行より前の発生時刻は記録しない
    metrics.recordOutboxPublishDelay(Instant.parse("2024-01-10T02:11:05Z"), Instant.EPOCH);
    metrics.updateOutboxFailedCurrent(-1);

    assertThat(registry.get("crons.sweep.detected").tag("kind", "missed").counter().count())
        .isEqualTo(4.0d);
    assertThat(registry.find("crons.sweep.detected").tag("kind", "timeout").counter()).isNull();
    assertThat(registry.get("crons.sweep.monitor.failed").counter().count()).isEqualTo(1.0d);
    assertThat(registry.get("crons.sweep.duration").timer().count()).isEqualTo(1L);
    assertThat(registry.get("crons.outbox.publish.delay").timer().count()).isZero();
    assertThat(registry.get("crons.outbox.failed.current").gauge().value()).isZero();
  }
}
