/*
 * どこで: Crons サービス層
 * 何を: 閾値判定で発生した遷移を transition_outbox へ積み、コミット後にログ/メトリクスへ流す
 * なぜ: status の切り替えとイベント登録を同じ CAS トランザクションに含めるため
 */
package com.example.crons.service;

import com.example.common.TraceIds;
import com.example.common.event.MonitorTransitionEventPayload;
import com.example.crons.model.MonitorRecord;
import com.example.crons.model.MonitorTransition;
import com.example.crons.repository.OutboxEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TransitionRecorder {

  private static final Logger logger = LoggerFactory.getLogger(TransitionRecorder.class);
  static final String EVENT_TYPE = "MonitorTransition";

  private final OutboxEventRepository outboxEventRepository;
  private final ObjectMapper objectMapper;
  private final CronsMetrics metrics;

  /** CAS トランザクション内で呼ぶ。遷移が無ければ何も書かない。 */
  public Optional<MonitorTransition> record(
      MonitorRecord monitor, ThresholdDecision decision, Instant occurredAt) {
    if (!decision.hasTransition()) {
      return Optional.empty();
    }
    final MonitorTransition transition =
        new MonitorTransition(
            UUID.randomUUID(),
            monitor.slug(),
            monitor.environment(),
            decision.transition(),
            decision.consecutiveCount(),
            occurredAt);
    final MonitorTransitionEventPayload payload =
        new MonitorTransitionEventPayload(
            transition.eventId().toString(),
            transition.monitorSlug(),
            transition.environment(),
            transition.transition().name(),
            transition.consecutiveCount(),
            occurredAt.toString(),
            TraceIds.resolve(MDC.get("trace_id")));
    outboxEventRepository.insert(
        transition.eventId(),
        EVENT_TYPE,
        aggregateKey(monitor),
        toJson(payload),
        occurredAt);
    return Optional.of(transition);
  }

  /** コミット後に呼ぶ。ロールバックされた遷移を記録しないため。 */
  public void afterCommit(List<MonitorTransition> transitions) {
    for (MonitorTransition transition : transitions) {
      metrics.recordTransition(transition.transition().name());
      logger.info(
          "monitor {} slug={} environment={} consecutiveCount={} eventId={}",
          transition.transition().name().toLowerCase(Locale.ROOT),
          transition.monitorSlug(),
          transition.environment(),
          transition.consecutiveCount(),
          transition.eventId());
    }
  }

  static String aggregateKey(MonitorRecord monitor) {
    return monitor.slug() + ":" + monitor.environment();
  }

  private String toJson(MonitorTransitionEventPayload payload) {
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize transition payload", ex);
    }
  }
}
