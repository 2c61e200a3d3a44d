package com.example.crons.support;

import java.time.Clock;
import java.time.Instant;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

// 同じ構成を @Import したテストクラス間でコンテキストと Clock を共有する
@TestConfiguration
public class MutableClockConfig {

  @Bean(name = "testClock")
  @Primary
  MutableClock clock() {
    return new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
  }
}
