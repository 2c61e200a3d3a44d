/*
 * どこで: Crons サービス層
 * 何を: チェックインを Run に解決し、開始/終端の記録と閾値判定を CAS で適用する
 * なぜ: 同一モニターへの同時チェックインやスイープと競合しても Run を二重に閉じないため
 */
package com.example.crons.service;

import com.example.crons.api.CheckInConflictException;
import com.example.crons.api.CheckInDeadlineExceededException;
import com.example.crons.api.CheckInRateLimitedException;
import com.example.crons.api.InvalidCheckInException;
import com.example.crons.api.MonitorNotFoundException;
import com.example.crons.config.CronsMonitorDefaultsProperties;
import com.example.crons.model.CheckInOutcome;
import com.example.crons.model.CheckInRecord;
import com.example.crons.model.CheckInStatus;
import com.example.crons.model.MonitorRecord;
import com.example.crons.model.MonitorState;
import com.example.crons.model.MonitorTransition;
import com.example.crons.model.RunRecord;
import com.example.crons.model.RunStatus;
import com.example.crons.repository.CheckInRepository;
import com.example.crons.repository.MonitorRunRepository;
import com.example.crons.schedule.ScheduleEvaluator;
import com.example.crons.store.CasResult;
import com.example.crons.store.MonitorStore;
import com.example.crons.store.MonitorVersionConflictException;
import com.example.crons.store.StoreDeadlineExceededException;
import com.example.crons.store.StoreRetryExecutor;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CheckInIngestService {

  private static final Logger logger = LoggerFactory.getLogger(CheckInIngestService.class);
  // heartbeat の開始時刻を逆算する上限 (365 日)。これより長い所要時間は受け付けない
  private static final double MAX_DURATION_SECONDS = 31_536_000d;

  private final MonitorStore monitorStore;
  private final StoreRetryExecutor storeRetryExecutor;
  private final MonitorRunRepository runRepository;
  private final CheckInRepository checkInRepository;
  private final CheckInRateLimiter rateLimiter;
  private final ScheduleEvaluator scheduleEvaluator;
  private final ThresholdEngine thresholdEngine;
  private final TransitionRecorder transitionRecorder;
  private final CronsMonitorDefaultsProperties defaults;
  private final CronsMetrics metrics;
  private final Clock clock;

  /**
   * チェックインを取り込む。
   *
   * @param timeout 呼び出し元が待てる時間。null なら期限なし
   */
  public CheckInResult ingest(CheckInCommand command, @Nullable Duration timeout) {
    final Instant receivedAt = Instant.now(clock);
    final Instant deadline = timeout == null ? null : receivedAt.plus(timeout);
    final String environment = resolveEnvironment(command.environment());
    try (MDC.MDCCloseable ignoredSlug = MDC.putCloseable("monitor_slug", command.slug());
        MDC.MDCCloseable ignoredEnvironment = MDC.putCloseable("environment", environment)) {
      validate(command);
      final CheckInResult result = ingestWithin(command, environment, receivedAt, deadline);
      metrics.recordCheckIn(
          command.status().value(), result.outcome().name().toLowerCase(Locale.ROOT));
      return result;
    } catch (StoreDeadlineExceededException ex) {
      metrics.recordCheckIn(command.status().value(), "deadline_exceeded");
      throw new CheckInDeadlineExceededException("check-in deadline exceeded", ex);
    } catch (MonitorVersionConflictException ex) {
      metrics.recordCheckIn(command.status().value(), "conflict");
      throw new CheckInConflictException("check-in conflicted with concurrent updates", ex);
    }
  }

  private CheckInResult ingestWithin(
      CheckInCommand command, String environment, Instant receivedAt, @Nullable Instant deadline) {
    final String slug = command.slug();
    final MonitorRecord monitor =
        storeRetryExecutor.call(
            () ->
                command.config() == null
                    ? monitorStore
                        .find(slug, environment)
                        .orElseThrow(() -> new MonitorNotFoundException(slug, environment))
                    : monitorStore.upsert(slug, environment, command.config()),
            deadline);

    final boolean allowed =
        storeRetryExecutor.call(
            () -> rateLimiter.tryAcquire(slug, environment, receivedAt), deadline);
    if (!allowed) {
      metrics.recordCheckIn(command.status().value(), "rate_limited");
      logger.info("check-in rate limited slug={} environment={}", slug, environment);
      throw new CheckInRateLimitedException(slug, environment);
    }

    final Applied applied =
        storeRetryExecutor.compareAndSet(
            monitor,
            () ->
                monitorStore
                    .findById(monitor.monitorId())
                    .orElseThrow(() -> new MonitorNotFoundException(slug, environment)),
            snapshot -> apply(snapshot, command, receivedAt),
            deadline);
    transitionRecorder.afterCommit(applied.transitions());
    logger.debug(
        "check-in applied slug={} environment={} status={} outcome={}",
        slug,
        environment,
        command.status().value(),
        applied.result().outcome());
    return applied.result();
  }

  private CasResult<Applied> apply(
      MonitorRecord snapshot, CheckInCommand command, Instant receivedAt) {
    if (command.status() == CheckInStatus.IN_PROGRESS) {
      return applyStart(snapshot, command, receivedAt);
    }
    return applyTerminal(snapshot, command, receivedAt);
  }

  private CasResult<Applied> applyStart(
      MonitorRecord snapshot, CheckInCommand command, Instant receivedAt) {
    final Instant expectedAt = scheduleEvaluator.nearestExpected(snapshot.schedule(), receivedAt);
    final RunRecord run = findOrCreateRun(snapshot, expectedAt, receivedAt);
    MonitorState state = snapshot.state();
    final CheckInOutcome outcome;
    if (run.isTerminal()) {
      // MISSED/TIMEOUT 済みの Run を遅れた開始で蘇らせない
      outcome = CheckInOutcome.IGNORED_TERMINAL;
    } else if (run.startedAt() != null) {
      outcome = CheckInOutcome.DUPLICATE_START;
    } else {
      runRepository.markStarted(run.runRef(), command.checkInId(), receivedAt, receivedAt);
      state = state.withLastRunId(command.checkInId());
      outcome = CheckInOutcome.STARTED;
    }
    recordCheckIn(snapshot, command, receivedAt, run.runRef(), outcome);
    final String responseId = command.checkInId();
    return new CasResult<>(
        state, new Applied(new CheckInResult(responseId, run.runRef(), outcome), List.of()));
  }

  private CasResult<Applied> applyTerminal(
      MonitorRecord snapshot, CheckInCommand command, Instant receivedAt) {
    final RunStatus runStatus = command.status().toRunStatus();
    final Optional<RunRecord> located = locateRun(snapshot, command.checkInId());
    final RunRecord run;
    final CheckInOutcome outcome;
    if (located.isPresent()) {
      run = located.get();
      if (run.isTerminal()
          || runRepository.markTerminal(run.runRef(), runStatus, receivedAt, receivedAt) == 0) {
        outcome = CheckInOutcome.IGNORED_TERMINAL;
      } else {
        outcome = CheckInOutcome.CLOSED;
      }
    } else {
      // 開始チェックインの無い単発の終端 (heartbeat)。開始時刻は所要時間から逆算する
      final Instant startedAt = receivedAt.minus(toDuration(command.durationSeconds()));
      final Instant expectedAt = scheduleEvaluator.nearestExpected(snapshot.schedule(), startedAt);
      run = findOrCreateRun(snapshot, expectedAt, receivedAt);
      final String runId =
          command.checkInId() == null ? UUID.randomUUID().toString() : command.checkInId();
      // 同じ予定時刻に別 id で開始済みの Run は、その id の終端チェックインに任せる
      final boolean startedByOther =
          run.startedAt() != null && run.runId() != null && !run.runId().equals(runId);
      if (run.isTerminal()
          || startedByOther
          || runRepository.closeHeartbeat(
                  run.runRef(), runId, startedAt, runStatus, receivedAt, receivedAt)
              == 0) {
        outcome = CheckInOutcome.IGNORED_TERMINAL;
      } else {
        outcome = CheckInOutcome.HEARTBEAT;
      }
    }
    recordCheckIn(snapshot, command, receivedAt, run.runRef(), outcome);

    final String responseId = resolveResponseId(command, run);
    if (outcome == CheckInOutcome.IGNORED_TERMINAL) {
      return new CasResult<>(
          snapshot.state(),
          new Applied(new CheckInResult(responseId, run.runRef(), outcome), List.of()));
    }
    final ThresholdDecision decision =
        thresholdEngine.apply(
            snapshot.state(),
            snapshot.config().failureThreshold(),
            snapshot.config().recoveryThreshold(),
            runStatus);
    final List<MonitorTransition> transitions =
        transitionRecorder.record(snapshot, decision, receivedAt).map(List::of).orElse(List.of());
    return new CasResult<>(
        decision.state(),
        new Applied(new CheckInResult(responseId, run.runRef(), outcome), transitions));
  }

  // id があれば run_id 一致 → 同 id の開始チェックインが解決した Run の順で探す。
  // 未知の id は別の実行中 Run を閉じず heartbeat として扱う。id が無いときだけ最新の実行中 Run
  private Optional<RunRecord> locateRun(MonitorRecord snapshot, @Nullable String checkInId) {
    if (checkInId == null) {
      return runRepository.findLatestOpen(snapshot.monitorId());
    }
    final Optional<RunRecord> byRunId = runRepository.findByRunId(snapshot.monitorId(), checkInId);
    if (byRunId.isPresent()) {
      return byRunId;
    }
    return checkInRepository
        .findStartedRunRef(snapshot.monitorId(), checkInId)
        .flatMap(runRepository::findByRunRef);
  }

  private RunRecord findOrCreateRun(MonitorRecord snapshot, Instant expectedAt, Instant now) {
    runRepository.insertIfAbsent(
        snapshot.monitorId(),
        expectedAt,
        snapshot.config().checkinMarginMinutes(),
        snapshot.config().maxRuntimeMinutes(),
        now);
    return runRepository
        .findByExpectedAt(snapshot.monitorId(), expectedAt)
        .orElseThrow(
            () ->
                new IllegalStateException(
                    "run disappeared after insert monitorId="
                        + snapshot.monitorId()
                        + " expectedAt="
                        + expectedAt));
  }

  private void recordCheckIn(
      MonitorRecord snapshot,
      CheckInCommand command,
      Instant receivedAt,
      UUID runRef,
      CheckInOutcome outcome) {
    checkInRepository.insert(
        new CheckInRecord(
            UUID.randomUUID(),
            snapshot.monitorId(),
            command.checkInId(),
            command.status(),
            command.durationSeconds(),
            receivedAt,
            runRef,
            outcome));
  }

  private String resolveResponseId(CheckInCommand command, RunRecord run) {
    if (command.checkInId() != null) {
      return command.checkInId();
    }
    return runRepository.findByRunRef(run.runRef()).map(RunRecord::runId).orElse(run.runId());
  }

  private void validate(CheckInCommand command) {
    if (command.slug() == null || command.slug().isBlank()) {
      throw new InvalidCheckInException("slug is required");
    }
    if (command.status() == null) {
      throw new InvalidCheckInException("status is required");
    }
    if (command.status() == CheckInStatus.IN_PROGRESS
        && (command.checkInId() == null || command.checkInId().isBlank())) {
      throw new InvalidCheckInException("check_in_id is required for in_progress");
    }
    final Double durationSeconds = command.durationSeconds();
    if (durationSeconds != null && (durationSeconds.isNaN() || durationSeconds.isInfinite())) {
      throw new InvalidCheckInException("duration_seconds must be a finite number");
    }
    if (durationSeconds != null && durationSeconds < 0) {
      throw new InvalidCheckInException("duration_seconds must be >= 0");
    }
    if (durationSeconds != null && durationSeconds > MAX_DURATION_SECONDS) {
      throw new InvalidCheckInException(
          "duration_seconds must be <= " + (long) MAX_DURATION_SECONDS);
    }
  }

  private String resolveEnvironment(@Nullable String environment) {
    if (environment == null || environment.isBlank()) {
      return defaults.environment();
    }
    return environment.trim();
  }

  private Duration toDuration(@Nullable Double durationSeconds) {
    if (durationSeconds == null) {
      return Duration.ZERO;
    }
    return Duration.ofMillis(Math.round(durationSeconds * 1000d));
  }

  private record Applied(CheckInResult result, List<MonitorTransition> transitions) {}
}
