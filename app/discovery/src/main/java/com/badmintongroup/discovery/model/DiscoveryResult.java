/*
 * どこで: Discovery ドメインモデル
 * 何を: 検索結果 1 件 (距離とスコア付き) を表現する
 * なぜ: ストアのレコードから呼び出し側に見せる項目だけを切り出すため
 */
package com.badmintongroup.discovery.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

public record DiscoveryResult(
    String id,
    String name,
    String location,
    @JsonInclude(JsonInclude.Include.NON_NULL) Double distanceKm,
    Instant scheduledAt,
    int currentPlayers,
    int maxPlayers,
    SkillLevel skillLevel,
    String courtType,
    String organizerName,
    SessionVisibility visibility,
    int relevanceScore,
    @JsonIgnore Double latitude,
    @JsonIgnore Double longitude) {

  public static final String UNKNOWN_LOCATION = "Location not specified";

  public static DiscoveryResult from(SessionRecord record, Double distanceKm, int relevanceScore) {
    return new DiscoveryResult(
        record.id(),
        record.name(),
        record.location() == null || record.location().isBlank()
            ? UNKNOWN_LOCATION
            : record.location(),
        distanceKm,
        record.scheduledAt(),
        record.currentPlayers(),
        record.maxPlayers(),
        record.skillLevel(),
        record.courtType(),
        record.organizerName(),
        record.visibility(),
        relevanceScore,
        record.latitude(),
        record.longitude());
  }

  public DiscoveryResult withDistanceKm(Double value) {
    return new DiscoveryResult(
        id,
        name,
        location,
        value,
        scheduledAt,
        currentPlayers,
        maxPlayers,
        skillLevel,
        courtType,
        organizerName,
        visibility,
        relevanceScore,
        latitude,
        longitude);
  }

  public boolean hasCoordinates() {
    return latitude != null && longitude != null;
  }
}
