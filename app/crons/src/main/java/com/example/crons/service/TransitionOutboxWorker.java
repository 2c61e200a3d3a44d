/*
 * どこで: Crons outbox ワーカー
 * 何を: スケジュールで transition outbox の publish を起動する
 * なぜ: 定期的に未送信の遷移イベントを処理するため
 */
package com.example.crons.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "crons.outbox.enabled", havingValue = "true", matchIfMissing = true)
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class TransitionOutboxWorker {

  private static final Logger logger = LoggerFactory.getLogger(TransitionOutboxWorker.class);

  private final TransitionOutboxPublisher publisher;

  @Scheduled(fixedDelayString = "${crons.outbox.poll-interval}")
  public void run() {
    try {
      publisher.publishPendingBatch();
    } catch (RuntimeException ex) {
      logger.warn("transition outbox publish pass failed", ex);
    }
  }
}
