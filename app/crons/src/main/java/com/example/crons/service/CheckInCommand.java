package com.example.crons.service;

import com.example.crons.model.CheckInStatus;
import com.example.crons.model.MonitorConfig;
import org.springframework.lang.Nullable;

/**
 * 取り込み対象の 1 件のチェックイン。
 *
 * @param environment null なら既定の環境
 * @param config null ならモニターが既に存在している必要がある
 */
public record CheckInCommand(
    String slug,
    @Nullable String environment,
    CheckInStatus status,
    @Nullable String checkInId,
    @Nullable Double durationSeconds,
    @Nullable MonitorConfig config) {}
