/*
 * どこで: Crons サービス層
 * 何を: モニターの現在状態と直近の Run を参照用に組み立てる
 * なぜ: 閾値判定の進み具合を API から確認できるようにするため
 */
package com.example.crons.service;

import com.example.crons.api.MonitorNotFoundException;
import com.example.crons.api.request.CrontabScheduleRequest;
import com.example.crons.api.request.IntervalScheduleRequest;
import com.example.crons.api.request.ScheduleRequest;
import com.example.crons.api.response.MonitorResponse;
import com.example.crons.api.response.RunSummary;
import com.example.crons.api.response.RunsResponse;
import com.example.crons.config.CronsMonitorDefaultsProperties;
import com.example.crons.model.MonitorConfig;
import com.example.crons.model.MonitorRecord;
import com.example.crons.model.RunRecord;
import com.example.crons.model.ScheduleType;
import com.example.crons.repository.MonitorRunRepository;
import com.example.crons.store.MonitorStore;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MonitorQueryService {

  private final MonitorStore monitorStore;
  private final MonitorRunRepository runRepository;
  private final CronsMonitorDefaultsProperties defaults;

  public MonitorResponse getMonitor(String slug, String environment) {
    final MonitorRecord monitor = load(slug, environment);
    final MonitorConfig config = monitor.config();
    return new MonitorResponse(
        monitor.slug(),
        monitor.environment(),
        toSchedule(config),
        config.timezone().getId(),
        config.checkinMarginMinutes(),
        config.maxRuntimeMinutes(),
        config.failureThreshold(),
        config.recoveryThreshold(),
        monitor.state().status().name(),
        monitor.state().consecutiveFailures(),
        monitor.state().consecutiveSuccesses(),
        monitor.state().lastExpectedRunAt(),
        monitor.state().lastRunId(),
        monitor.createdAt(),
        monitor.updatedAt());
  }

  public RunsResponse listRuns(String slug, String environment, int limit) {
    final MonitorRecord monitor = load(slug, environment);
    final List<RunSummary> runs =
        runRepository.findRecent(monitor.monitorId(), limit).stream()
            .map(this::toSummary)
            .toList();
    return new RunsResponse(monitor.slug(), monitor.environment(), runs);
  }

  private MonitorRecord load(String slug, String environment) {
    final String resolved =
        environment == null || environment.isBlank() ? defaults.environment() : environment;
    return monitorStore
        .find(slug, resolved)
        .orElseThrow(() -> new MonitorNotFoundException(slug, resolved));
  }

  private ScheduleRequest toSchedule(MonitorConfig config) {
    if (config.scheduleType() == ScheduleType.CRONTAB) {
      return new CrontabScheduleRequest(config.crontab());
    }
    return new IntervalScheduleRequest(config.intervalValue(), config.intervalUnit().value());
  }

  private RunSummary toSummary(RunRecord run) {
    final String status;
    if (run.terminalStatus() != null) {
      status = run.terminalStatus().name().toLowerCase(Locale.ROOT);
    } else if (run.startedAt() != null) {
      status = "in_progress";
    } else {
      status = "pending";
    }
    return new RunSummary(run.runId(), run.expectedAt(), run.startedAt(), run.finishedAt(), status);
  }
}
