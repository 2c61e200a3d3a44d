/*
 * どこで: Crons retention サービス
 * 何を: publish 済みの遷移イベントと使われなくなった流量制限窓を削除する
 * なぜ: テーブル肥大化を防ぎ、運用負荷を下げるため
 */
package com.example.crons.service;

import com.example.crons.config.CronsOutboxProperties;
import com.example.crons.config.CronsRateLimitProperties;
import com.example.crons.repository.OutboxEventRepository;
import com.example.crons.repository.RateLimitWindowRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CronsRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(CronsRetentionService.class);

  private final OutboxEventRepository outboxEventRepository;
  private final RateLimitWindowRepository rateLimitWindowRepository;
  private final CronsOutboxProperties outboxProperties;
  private final CronsRateLimitProperties rateLimitProperties;
  private final Clock clock;

  public void cleanup() {
    final Instant now = Instant.now(clock);
    final Instant outboxThreshold = now.minus(outboxProperties.publishedTtl());
    final int deletedOutbox = outboxEventRepository.deletePublishedOlderThan(outboxThreshold);
    // 窓より長い idle-ttl で消すので、進行中の窓を消すことはない
    final Instant rateLimitThreshold = now.minus(rateLimitProperties.idleTtl());
    final int deletedWindows = rateLimitWindowRepository.deleteIdleBefore(rateLimitThreshold);
    logger.info(
        "crons retention cleanup deleted outboxEvents={} rateLimitWindows={}"
            + " outboxThreshold={} rateLimitThreshold={}",
        deletedOutbox,
        deletedWindows,
        outboxThreshold,
        rateLimitThreshold);
  }
}
