/*
 * どこで: Crons アプリの設定バインド
 * 何を: チェックインの monitor_config で省略された項目の既定値を保持する
 * なぜ: SDK ごとに既定値がばらつかないようサーバ側で補うため
 */
package com.example.crons.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "crons.monitor-defaults")
public record CronsMonitorDefaultsProperties(
    @NotBlank String environment,
    @NotBlank String timezone,
    @Min(0) int checkinMargin,
    @Min(0) int maxRuntime,
    @Min(1) int failureThreshold,
    @Min(1) int recoveryThreshold) {}
