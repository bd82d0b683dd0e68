/*
 * どこで: Discovery ドメインモデル
 * 何を: ストアから読み出したセッション 1 件を表現する
 * なぜ: Discovery はセッションを所有せず読み取り専用で扱うため
 */
package com.badmintongroup.discovery.model;

import java.time.Instant;

public record SessionRecord(
    String id,
    String name,
    String location,
    Double latitude,
    Double longitude,
    Instant scheduledAt,
    int maxPlayers,
    int currentPlayers,
    SkillLevel skillLevel,
    String courtType,
    SessionVisibility visibility,
    SessionStatus status,
    String organizerName,
    String shareCode) {

  public boolean hasCoordinates() {
    return latitude != null && longitude != null;
  }

  public boolean isActive() {
    return status == SessionStatus.ACTIVE;
  }
}
