/*
 * どこで: Crons サービス層
 * 何を: 全モニターを走査し、来なかった予定実行を MISSED、終わらない実行を TIMEOUT で閉じる
 * なぜ: チェックインが届かないこと自体を失敗として閾値判定に流すため
 */
package com.example.crons.service;

import com.example.crons.config.CronsSweepProperties;
import com.example.crons.model.MonitorRecord;
import com.example.crons.model.MonitorState;
import com.example.crons.model.MonitorTransition;
import com.example.crons.model.RunRecord;
import com.example.crons.model.RunStatus;
import com.example.crons.repository.MonitorRunRepository;
import com.example.crons.repository.SweepLeaseRepository;
import com.example.crons.schedule.Schedule;
import com.example.crons.schedule.ScheduleEvaluator;
import com.example.crons.schedule.WindowState;
import com.example.crons.store.CasResult;
import com.example.crons.store.MonitorStore;
import com.example.crons.store.StoreRetryExecutor;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MonitorSweepService {

  private static final Logger logger = LoggerFactory.getLogger(MonitorSweepService.class);
  static final String LEASE_NAME = "monitor-sweep";

  private final MonitorStore monitorStore;
  private final StoreRetryExecutor storeRetryExecutor;
  private final MonitorRunRepository runRepository;
  private final SweepLeaseRepository leaseRepository;
  private final ScheduleEvaluator scheduleEvaluator;
  private final ThresholdEngine thresholdEngine;
  private final TransitionRecorder transitionRecorder;
  private final CronsSweepProperties properties;
  private final CronsMetrics metrics;
  private final Clock clock;

  public SweepSummary sweep() {
    final Instant startedAt = Instant.now(clock);
    final String owner = NodeIdentity.resolve();
    if (!leaseRepository.tryAcquire(
        LEASE_NAME, owner, startedAt, startedAt.plus(properties.lease()))) {
      logger.debug("sweep skipped because lease is held by another node owner={}", owner);
      return SweepSummary.skipped();
    }
    int scanned = 0;
    int missed = 0;
    int timedOut = 0;
    int failed = 0;
    try {
      UUID afterId = null;
      while (true) {
        final List<MonitorRecord> page = monitorStore.findPageAfter(afterId, properties.batchSize());
        for (MonitorRecord monitor : page) {
          scanned++;
          try {
            final Detection detection = sweepMonitor(monitor);
            missed += detection.missed();
            timedOut += detection.timedOut();
          } catch (RuntimeException ex) {
            // 1 モニターの失敗でパス全体を止めない。次のパスで再評価される
            failed++;
            metrics.recordSweepMonitorFailure();
            logger.warn(
                "sweep failed for monitor slug={} environment={}",
                monitor.slug(),
                monitor.environment(),
                ex);
          }
        }
        if (page.size() < properties.batchSize()) {
          break;
        }
        afterId = page.get(page.size() - 1).monitorId();
      }
    } finally {
      leaseRepository.release(LEASE_NAME, owner, Instant.now(clock));
    }
    metrics.recordSweepDetected(RunStatus.MISSED.name(), missed);
    metrics.recordSweepDetected(RunStatus.TIMEOUT.name(), timedOut);
    metrics.recordSweepDuration(Duration.between(startedAt, Instant.now(clock)));
    if (missed > 0 || timedOut > 0 || failed > 0) {
      logger.info(
          "sweep finished scanned={} missed={} timedOut={} failed={}",
          scanned,
          missed,
          timedOut,
          failed);
    }
    return new SweepSummary(true, scanned, missed, timedOut, failed);
  }

  @VisibleForTesting
  Detection sweepMonitor(MonitorRecord monitor) {
    final Instant now = Instant.now(clock);
    final Instant deadline = now.plus(properties.perMonitorTimeout());
    try (MDC.MDCCloseable ignoredSlug = MDC.putCloseable("monitor_slug", monitor.slug());
        MDC.MDCCloseable ignoredEnvironment =
            MDC.putCloseable("environment", monitor.environment())) {
      if (!needsWork(monitor, now, deadline)) {
        return Detection.NONE;
      }
      // 競合時は読み直した最新状態で判断し直す。既に閉じられた Run は数えない
      final Detection detection =
          storeRetryExecutor.compareAndSet(
              monitor,
              () ->
                  monitorStore
                      .findById(monitor.monitorId())
                      .orElseThrow(
                          () ->
                              new IllegalStateException(
                                  "monitor disappeared monitorId=" + monitor.monitorId())),
              snapshot -> detect(snapshot, now),
              deadline);
      transitionRecorder.afterCommit(detection.transitions());
      return detection;
    }
  }

  // 書込みトランザクションを開く前の読み取りだけの判定
  private boolean needsWork(MonitorRecord monitor, Instant now, Instant deadline) {
    final Instant next = scheduleEvaluator.nextExpected(monitor.schedule(), sweepCursor(monitor));
    if (scheduleEvaluator.inWindow(next, monitor.config().checkinMargin(), now)
        == WindowState.MISSED) {
      return true;
    }
    return storeRetryExecutor
        .call(() -> runRepository.findOpen(monitor.monitorId()), deadline)
        .stream()
        .anyMatch(run -> run.isOverdue(now));
  }

  private CasResult<Detection> detect(MonitorRecord snapshot, Instant now) {
    final Schedule schedule = snapshot.schedule();
    final Duration margin = snapshot.config().checkinMargin();
    final List<MonitorTransition> transitions = new ArrayList<>();
    MonitorState state = snapshot.state();

    final Instant initialCursor = sweepCursor(snapshot);
    Instant cursor = initialCursor;
    int missed = 0;
    for (int i = 0; i < properties.maxOccurrencesPerMonitor(); i++) {
      final Instant expected = scheduleEvaluator.nextExpected(schedule, cursor);
      if (scheduleEvaluator.inWindow(expected, margin, now) != WindowState.MISSED) {
        break;
      }
      final int inserted =
          runRepository.insertMissedIfAbsent(
              snapshot.monitorId(),
              UUID.randomUUID().toString(),
              expected,
              snapshot.config().checkinMarginMinutes(),
              snapshot.config().maxRuntimeMinutes(),
              now);
      if (inserted == 1) {
        missed++;
        state = countFailure(snapshot, state, RunStatus.MISSED, now, transitions);
      }
      cursor = expected;
    }
    if (!cursor.equals(initialCursor)) {
      state = state.withLastExpectedRunAt(cursor);
    }

    int timedOut = 0;
    for (RunRecord run : runRepository.findOpen(snapshot.monitorId())) {
      // max_runtime は Run 作成時のスナップショットを使う
      if (run.isOverdue(now)
          && runRepository.markTerminal(run.runRef(), RunStatus.TIMEOUT, now, now) == 1) {
        timedOut++;
        state = countFailure(snapshot, state, RunStatus.TIMEOUT, now, transitions);
      }
    }
    return new CasResult<>(state, new Detection(missed, timedOut, List.copyOf(transitions)));
  }

  private MonitorState countFailure(
      MonitorRecord snapshot,
      MonitorState state,
      RunStatus status,
      Instant now,
      List<MonitorTransition> transitions) {
    final ThresholdDecision decision =
        thresholdEngine.apply(
            state,
            snapshot.config().failureThreshold(),
            snapshot.config().recoveryThreshold(),
            status);
    transitionRecorder.record(snapshot, decision, now).ifPresent(transitions::add);
    return decision.state();
  }

  // スイープ済み位置。未スイープならモニター作成時刻から
  private Instant sweepCursor(MonitorRecord monitor) {
    final Instant lastExpected = monitor.state().lastExpectedRunAt();
    return lastExpected != null ? lastExpected : monitor.createdAt();
  }

  record Detection(int missed, int timedOut, List<MonitorTransition> transitions) {
    static final Detection NONE = new Detection(0, 0, List.of());
  }
}
