/*
 * どこで: Crons outbox publish サービス
 * 何を: transition_outbox を claim して NATS JetStream へ JSON で publish する
 * なぜ: status 遷移のコミットとイベント配信の整合性を保つため
 */
package com.example.crons.service;

import com.example.common.event.MonitorTransitionEventPayload;
import com.example.crons.config.CronsNatsProperties;
import com.example.crons.config.CronsOutboxProperties;
import com.example.crons.model.OutboxEventRecord;
import com.example.crons.model.OutboxStatus;
import com.example.crons.repository.OutboxEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "crons.outbox.enabled", havingValue = "true", matchIfMissing = true)
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class TransitionOutboxPublisher {

  private static final Logger logger = LoggerFactory.getLogger(TransitionOutboxPublisher.class);
  private static final String HEADER_MESSAGE_ID = "Nats-Msg-Id";
  private static final String HEADER_EVENT_TYPE = "event_type";
  private static final String HEADER_AGGREGATE_KEY = "aggregate_key";
  private static final String HEADER_TRACE_ID = "trace_id";

  private final JetStream jetStream;
  private final OutboxEventRepository outboxEventRepository;
  private final CronsOutboxProperties properties;
  private final CronsNatsProperties natsProperties;
  private final ObjectMapper objectMapper;
  private final CronsMetrics metrics;
  private final Clock clock;

  public void publishPendingBatch() {
    final Instant now = Instant.now(clock);
    final String lockedBy = NodeIdentity.resolve();
    final List<OutboxEventRecord> pending =
        outboxEventRepository.claimPending(
            properties.batchSize(), now, now.plus(properties.lease()), lockedBy);
    for (OutboxEventRecord record : pending) {
      try {
        final MonitorTransitionEventPayload payload = parsePayload(record);
        final PublishAck ack =
            jetStream.publish(
                natsProperties.subject(),
                buildHeaders(record, payload),
                record.payloadJson().getBytes(StandardCharsets.UTF_8));
        // puback を受け取れた場合のみ publish 成功とみなす
        if (ack == null) {
          throw new IllegalStateException("puback is missing");
        }
        final int updated = outboxEventRepository.markPublished(record.eventId(), lockedBy, now);
        if (updated == 0) {
          logger.warn("outbox publish succeeded but lock was lost eventId={}", record.eventId());
        } else {
          metrics.recordOutboxPublishDelay(parseTimestamp(payload.timestamp()), now);
        }
      } catch (JetStreamApiException | IOException ex) {
        handleFailure(record, ex, now, lockedBy);
      } catch (RuntimeException ex) {
        handleFailure(record, ex, now, lockedBy);
      }
    }
    metrics.updateOutboxFailedCurrent(outboxEventRepository.countFailed());
  }

  private MonitorTransitionEventPayload parsePayload(OutboxEventRecord record) {
    try {
      return objectMapper.readValue(record.payloadJson(), MonitorTransitionEventPayload.class);
    } catch (JsonProcessingException ex) {
      // パース不能はリトライしても回復しないので即時 FAILED に寄せる
      throw new OutboxPayloadParseException("outbox payload parse failure", ex);
    }
  }

  private Headers buildHeaders(OutboxEventRecord record, MonitorTransitionEventPayload payload) {
    final Headers headers = new Headers();
    // 重複排除キーとして event_id を NATS の標準ヘッダに載せる
    headers.add(HEADER_MESSAGE_ID, record.eventId().toString());
    headers.add(HEADER_EVENT_TYPE, record.eventType());
    headers.add(HEADER_AGGREGATE_KEY, record.aggregateKey());
    if (payload.traceId() != null) {
      headers.add(HEADER_TRACE_ID, payload.traceId());
    }
    return headers;
  }

  private void handleFailure(OutboxEventRecord record, Exception ex, Instant now, String lockedBy) {
    final boolean nonRetryable = ex instanceof OutboxPayloadParseException;
    final int nextAttempt = nonRetryable ? properties.maxAttempts() : record.attemptCount() + 1;
    final boolean failed = nonRetryable || nextAttempt >= properties.maxAttempts();
    final Instant nextRetryAt = failed ? null : now.plus(computeBackoffDuration(nextAttempt));
    final int updated =
        outboxEventRepository.markFailure(
            record.eventId(),
            lockedBy,
            nextAttempt,
            failed ? OutboxStatus.FAILED : OutboxStatus.PENDING,
            nextRetryAt,
            truncateError(ex.getMessage()));
    if (updated == 0) {
      logger.warn(
          "outbox retry skipped because lock was lost eventId={} attempt={}",
          record.eventId(),
          nextAttempt);
    }
    if (failed) {
      logger.error("transition outbox moved to FAILED eventId={}", record.eventId(), ex);
    } else {
      logger.warn(
          "transition outbox retry scheduled eventId={} attempt={}",
          record.eventId(),
          nextAttempt,
          ex);
    }
  }

  private Duration computeBackoffDuration(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp = baseMillis * Math.pow(properties.backoffExponentBase(), (attempt - 1));
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    final double jitterMin = properties.backoffJitterMin();
    final double jitterMax = properties.backoffJitterMax();
    final double jitter =
        jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    final long backoffMillis = (long) Math.ceil(capped * jitter);
    return Duration.ofMillis(Math.max(properties.backoffMin().toMillis(), backoffMillis));
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    return message.length() <= maxLength ? message : message.substring(0, maxLength);
  }

  private Instant parseTimestamp(String timestamp) {
    if (timestamp == null) {
      return null;
    }
    try {
      return Instant.parse(timestamp);
    } catch (DateTimeParseException ex) {
      logger.debug("transition timestamp is not ISO-8601 timestamp={}", timestamp);
      return null;
    }
  }

  private static final class OutboxPayloadParseException extends RuntimeException {
    private OutboxPayloadParseException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
