/*
 * どこで: Crons アプリの設定バインド
 * 何を: CAS 再試行とストア障害時の再試行、トランザクション上限を保持する
 * なぜ: 競合の多いモニターや DB 瞬断時の振る舞いを運用で調整できるようにするため
 */
package com.example.crons.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "crons.store")
public record CronsStoreProperties(
    @Min(1) int maxCasAttempts,
    @Min(1) int maxStoreAttempts,
    @NotNull Duration backoffBase,
    @NotNull Duration backoffMax,
    double backoffExponentBase,
    double backoffJitterMin,
    double backoffJitterMax,
    @NotNull Duration transactionTimeout) {}
