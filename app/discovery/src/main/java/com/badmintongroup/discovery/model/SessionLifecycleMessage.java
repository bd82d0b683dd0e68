/*
 * どこで: Discovery ドメインモデル
 * 何を: Session サブシステムから届く変更通知の payload を定義する
 * なぜ: NATS 上の JSON 形状をサービス間で固定するため
 */
package com.badmintongroup.discovery.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SessionLifecycleMessage(
    String eventId,
    String eventType,
    String sessionId,
    String shareCode,
    String occurredAt,
    String traceId) {}
