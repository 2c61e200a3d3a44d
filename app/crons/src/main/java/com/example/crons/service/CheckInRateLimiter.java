/*
 * どこで: Crons サービス層
 * 何を: (slug, environment) 単位の固定窓でチェックイン流量を制限する
 * なぜ: 暴走したジョブがストアと監査ログを埋め尽くさないようにするため
 */
package com.example.crons.service;

import com.example.crons.config.CronsRateLimitProperties;
import com.example.crons.repository.RateLimitWindowRepository;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CheckInRateLimiter {

  private final RateLimitWindowRepository rateLimitWindowRepository;
  private final CronsRateLimitProperties properties;

  /** 窓内の件数を 1 進め、上限以内なら true。拒否された分も件数には数える。 */
  public boolean tryAcquire(String slug, String environment, Instant now) {
    final int count =
        rateLimitWindowRepository.incrementAndGet(
            slug, environment, now, now.minus(properties.window()));
    return count <= properties.quota();
  }
}
