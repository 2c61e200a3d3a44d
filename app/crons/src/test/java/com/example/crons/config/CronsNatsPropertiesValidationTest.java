/*
 * どこで: Crons 設定バインドのバリデーションテスト
 * 何を: crons.nats の必須設定を検証する
 * なぜ: 起動時に設定不備を検知して publish 時の失敗を防ぐため
 */
package com.example.crons.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.assertj.core.util.Throwables;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.assertj.AssertableApplicationContext;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.ContextConsumer;
import org.springframework.context.annotation.Configuration;

class CronsNatsPropertiesValidationTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(TestConfiguration.class);

  @Test
  void contextFailsWhenSubjectIsBlank() {
    contextRunner
        .withPropertyValues(
            "crons.nats.subject=   ",
            "crons.nats.stream=crons-monitor-transitions",
            "crons.nats.duplicate-window=2m")
        .run(assertValidationFailure("subject"));
  }

  @Test
  void contextFailsWhenStreamIsMissing() {
    contextRunner
        .withPropertyValues(
            "crons.nats.subject=crons.monitor.transitions", "crons.nats.duplicate-window=2m")
        .run(assertValidationFailure("stream"));
  }

  @Test
  void contextFailsWhenDuplicateWindowIsMissing() {
    contextRunner
        .withPropertyValues(
            "crons.nats.subject=crons.monitor.transitions",
            "crons.nats.stream=crons-monitor-transitions")
        .run(assertValidationFailure("duplicate"));
  }

  @Test
  void contextStartsWithCompleteSettings() {
    contextRunner
        .withPropertyValues(
            "crons.nats.subject=crons.monitor.transitions",
            "crons.nats.stream=crons-monitor-transitions",
            "crons.nats.duplicate-window=2m")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final CronsNatsProperties properties = context.getBean(CronsNatsProperties.class);
              assertThat(properties.subject()).isEqualTo("crons.monitor.transitions");
              assertThat(properties.stream()).isEqualTo("crons-monitor-transitions");
              assertThat(properties.duplicateWindow()).hasMinutes(2);
            });
  }

  private ContextConsumer<AssertableApplicationContext> assertValidationFailure(
      String expectedField) {
    return context -> {
      assertThat(context).hasFailed();
      final Throwable root = Throwables.getRootCause(context.getStartupFailure());
      assertThat(root).isInstanceOf(BindValidationException.class);
      assertThat(root.getMessage()).contains(expectedField);
    };
  }

  @Configuration
  @EnableConfigurationProperties(CronsNatsProperties.class)
  static class TestConfiguration {}
}
