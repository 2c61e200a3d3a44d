/*
 * どこで: Crons アプリの設定バインド
 * 何を: モニター単位のチェックイン流量制限を保持する
 * なぜ: 暴走したジョブからストアを守る上限を環境ごとに変えられるようにするため
 */
package com.example.crons.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "crons.rate-limit")
public record CronsRateLimitProperties(
    @NotNull Duration window, @Min(1) int quota, @NotNull Duration idleTtl) {}
