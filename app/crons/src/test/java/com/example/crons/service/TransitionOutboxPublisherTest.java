/*
 * どこで: Crons outbox publish のユニットテスト
 * 何を: 遷移イベントの publish 成功/再送予約/即時 FAILED と重複排除ヘッダを検証する
 * なぜ: puback 受信時のみ publish 成功とみなし、JetStream 側で重複を落とせることを保証するため
 */
package com.example.crons.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

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
import io.nats.client.api.Error;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TransitionOutboxPublisherTest {

  private static final Instant FIXED_NOW = Instant.parse("2024-01-10T02:11:05Z");
  // application.yaml と同じ値で固定する
  private static final CronsOutboxProperties PROPERTIES =
      new CronsOutboxProperties(
          true,
          Duration.ofSeconds(1),
          50,
          10,
          Duration.ofSeconds(1),
          Duration.ofSeconds(60),
          2.0d,
          0.5d,
          1.5d,
          Duration.ofSeconds(1),
          1000,
          Duration.ofSeconds(30),
          Duration.ofHours(24));
  private static final CronsNatsProperties NATS_PROPERTIES =
      new CronsNatsProperties(
          "crons.monitor.transitions", "crons-monitor-transitions", Duration.ofMinutes(2));

  @Mock private JetStream jetStream;

  @Mock private OutboxEventRepository outboxEventRepository;

  @Mock private CronsMetrics metrics;

  private ObjectMapper objectMapper;
  private TransitionOutboxPublisher publisher;

  @BeforeEach
  void setUp() {
    objectMapper = new ObjectMapper();
    publisher =
        new TransitionOutboxPublisher(
            jetStream,
            outboxEventRepository,
            PROPERTIES,
            NATS_PROPERTIES,
            objectMapper,
            metrics,
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void publishSendsPayloadWithDeduplicationHeaders() throws Exception {
    final UUID eventId = UUID.randomUUID();
    final OutboxEventRecord record = buildRecord(eventId, 0);
    stubClaim(record);
    when(jetStream.publish(eq(NATS_PROPERTIES.subject()), any(Headers.class), any(byte[].class)))
        .thenReturn(mock(PublishAck.class));
    when(outboxEventRepository.markPublished(eq(eventId), anyString(), eq(FIXED_NOW)))
        .thenReturn(1);

    publisher.publishPendingBatch();

    final ArgumentCaptor<Headers> headersCaptor = ArgumentCaptor.forClass(Headers.class);
    final ArgumentCaptor<byte[]> bodyCaptor = ArgumentCaptor.forClass(byte[].class);
    verify(jetStream)
        .publish(eq(NATS_PROPERTIES.subject()), headersCaptor.capture(), bodyCaptor.capture());
    assertThat(headersCaptor.getValue().getFirst("Nats-Msg-Id")).isEqualTo(eventId.toString());
    assertThat(headersCaptor.getValue().getFirst("event_type")).isEqualTo("MonitorTransition");
    assertThat(headersCaptor.getValue().getFirst("aggregate_key"))
        .isEqualTo("nightly-report:production");
    assertThat(headersCaptor.getValue().getFirst("trace_id")).isEqualTo("trace-1");
    assertThat(new String(bodyCaptor.getValue(), StandardCharsets.UTF_8))
        .isEqualTo(record.payloadJson());
    verify(metrics)
        .recordOutboxPublishDelay(Instant.parse("2024-01-10T02:11:00Z"), FIXED_NOW);
  }

  @Test
  void unparsablePayloadFailsWithoutPublishing() {
    final OutboxEventRecord record =
        new OutboxEventRecord(
            UUID.randomUUID(), "MonitorTransition", "nightly-report:production", "{broken", 0);
    stubClaim(record);
    when(outboxEventRepository.markFailure(
            eq(record.eventId()),
            anyString(),
            anyInt(),
            eq(OutboxStatus.FAILED),
            isNull(),
            anyString()))
        .thenReturn(1);

    publisher.publishPendingBatch();

    verifyNoInteractions(jetStream);
    verify(outboxEventRepository)
        .markFailure(
            eq(record.eventId()),
            anyString(),
            eq(PROPERTIES.maxAttempts()),
            eq(OutboxStatus.FAILED),
            isNull(),
            eq("outbox payload parse failure"));
  }

  @Test
  void publishFailureSchedulesRetryWithBackoff() throws Exception {
    final UUID eventId = UUID.randomUUID();
    stubClaim(buildRecord(eventId, 0));
    when(jetStream.publish(eq(NATS_PROPERTIES.subject()), any(Headers.class), any(byte[].class)))
        .thenThrow(new IOException("nats publish failed"));
    when(outboxEventRepository.markFailure(
            eq(eventId),
            anyString(),
            anyInt(),
            eq(OutboxStatus.PENDING),
            any(Instant.class),
            anyString()))
        .thenReturn(1);

    publisher.publishPendingBatch();

    final ArgumentCaptor<Instant> nextRetryCaptor = ArgumentCaptor.forClass(Instant.class);
    verify(outboxEventRepository)
        .markFailure(
            eq(eventId),
            anyString(),
            eq(1),
            eq(OutboxStatus.PENDING),
            nextRetryCaptor.capture(),
            eq("nats publish failed"));
    assertThat(nextRetryCaptor.getValue())
        .isAfterOrEqualTo(FIXED_NOW.plus(PROPERTIES.backoffMin()))
        .isBeforeOrEqualTo(FIXED_NOW.plusMillis(1500));
    verify(outboxEventRepository, never())
        .markPublished(any(UUID.class), anyString(), any(Instant.class));
  }

  @Test
  void lastAttemptMovesToFailed() throws Exception {
    final UUID eventId = UUID.randomUUID();
    stubClaim(buildRecord(eventId, PROPERTIES.maxAttempts() - 1));
    when(jetStream.publish(eq(NATS_PROPERTIES.subject()), any(Headers.class), any(byte[].class)))
        .thenThrow(new StreamUnavailableException());
    when(outboxEventRepository.markFailure(
            eq(eventId),
            anyString(),
            anyInt(),
            eq(OutboxStatus.FAILED),
            isNull(),
            anyString()))
        .thenReturn(1);
    when(outboxEventRepository.countFailed()).thenReturn(1);

    publisher.publishPendingBatch();

    verify(outboxEventRepository)
        .markFailure(
            eq(eventId),
            anyString(),
            eq(PROPERTIES.maxAttempts()),
            eq(OutboxStatus.FAILED),
            isNull(),
            eq("stream unavailable"));
    verify(metrics).updateOutboxFailedCurrent(1);
  }

  @Test
  void missingPubAckIsTreatedAsFailure() throws Exception {
    final UUID eventId = UUID.randomUUID();
    stubClaim(buildRecord(eventId, 0));
    when(jetStream.publish(eq(NATS_PROPERTIES.subject()), any(Headers.class), any(byte[].class)))
        .thenReturn(null);
    when(outboxEventRepository.markFailure(
            eq(eventId),
            anyString(),
            anyInt(),
            eq(OutboxStatus.PENDING),
            any(Instant.class),
            anyString()))
        .thenReturn(1);

    publisher.publishPendingBatch();

    verify(outboxEventRepository)
        .markFailure(
            eq(eventId),
            anyString(),
            eq(1),
            eq(OutboxStatus.PENDING),
            any(Instant.class),
            eq("puback is missing"));
  }

  private void stubClaim(OutboxEventRecord record) {
    when(outboxEventRepository.claimPending(
            eq(PROPERTIES.batchSize()), eq(FIXED_NOW), any(Instant.class), anyString()))
        .thenReturn(List.of(record));
  }

  private OutboxEventRecord buildRecord(UUID eventId, int attemptCount)
      throws JsonProcessingException {
    final MonitorTransitionEventPayload payload =
        new MonitorTransitionEventPayload(
            eventId.toString(),
            "nightly-report",
            "production",
            "DEGRADED",
            1,
            "2024-01-10T02:11:00Z",
            "trace-1");
    return new OutboxEventRecord(
        eventId,
        "MonitorTransition",
        "nightly-report:production",
        objectMapper.writeValueAsString(payload),
        attemptCount);
  }

  private static final class StreamUnavailableException extends JetStreamApiException {
    private StreamUnavailableException() {
      super(Error.JsBadRequestErr);
    }

    @Override
    public String getMessage() {
      return "stream unavailable";
    }
  }
}
