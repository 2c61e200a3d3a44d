/*
 * どこで: common のイベント payload 定義
 * 何を: モニターの DEGRADED/RECOVERED 遷移イベントを共通レコードとして提供する
 * なぜ: outbox 保存と NATS publish、外部のアラート配信側で同一のペイロード形状を共有するため
 */
package com.example.common.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MonitorTransitionEventPayload(
    String eventId,
    String monitorSlug,
    String environment,
    String transition,
    int consecutiveCount,
    String timestamp,
    String traceId) {}
