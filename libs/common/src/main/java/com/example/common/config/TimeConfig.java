/*
 * どこで: Common 共通設定
 * 何を: UTC の Clock を DI 可能にする
 * なぜ: スケジュール評価・スイープ・テストで同一の時刻注入を使うため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  // 期待実行時刻は UTC の Instant で保持し、タイムゾーン変換は評価時にだけ行う
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
