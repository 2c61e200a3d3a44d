/*
 * どこで: Crons アプリの設定バインド
 * 何を: 欠測/タイムアウト検出スイープの周期とリース、1 パスの上限を保持する
 * なぜ: 検出遅延と DB 負荷のバランスを運用で調整するため
 */
package com.example.crons.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "crons.sweep")
public record CronsSweepProperties(
    boolean enabled,
    @NotNull Duration pollInterval,
    @NotNull Duration lease,
    @Min(1) int batchSize,
    @Min(1) int maxOccurrencesPerMonitor,
    @NotNull Duration perMonitorTimeout) {}
