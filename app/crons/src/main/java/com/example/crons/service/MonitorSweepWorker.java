/*
 * どこで: Crons スイープワーカー
 * 何を: 固定遅延でスイープを起動する
 * なぜ: チェックインが来ないことを時間経過だけで検出するため
 */
package com.example.crons.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "crons.sweep.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class MonitorSweepWorker {

  private static final Logger logger = LoggerFactory.getLogger(MonitorSweepWorker.class);

  private final MonitorSweepService sweepService;

  @Scheduled(fixedDelayString = "${crons.sweep.poll-interval}")
  public void run() {
    try {
      sweepService.sweep();
    } catch (RuntimeException ex) {
      // リース取得や走査自体の失敗。次の周期で再試行する
      logger.warn("monitor sweep pass failed", ex);
    }
  }
}
