/*
 * どこで: Discovery ドメインモデル
 * 何を: 検証済みの検索条件を不変値として保持する
 * なぜ: HTTP 境界で一度だけ検証し、以降の層では再検証しないため
 */
package com.badmintongroup.discovery.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiscoveryFilter(
    Double latitude,
    Double longitude,
    Double radiusKm,
    Instant startTime,
    Instant endTime,
    SkillLevel skillLevel,
    Integer minPlayers,
    Integer maxPlayers,
    String courtType,
    int limit,
    int offset) {

  public static final double DEFAULT_RADIUS_KM = 50.0;
  public static final double MAX_RADIUS_KM = 500.0;
  public static final int DEFAULT_LIMIT = 20;
  public static final int MAX_LIMIT = 100;

  public DiscoveryFilter {
    if (radiusKm == null) {
      radiusKm = DEFAULT_RADIUS_KM;
    }
  }

  public boolean geoActive() {
    return latitude != null && longitude != null;
  }

  public boolean timeWindowActive() {
    return startTime != null || endTime != null;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private Double latitude;
    private Double longitude;
    private Double radiusKm;
    private Instant startTime;
    private Instant endTime;
    private SkillLevel skillLevel;
    private Integer minPlayers;
    private Integer maxPlayers;
    private String courtType;
    private int limit = DEFAULT_LIMIT;
    private int offset;

    private Builder() {}

    public Builder position(Double latitude, Double longitude) {
      this.latitude = latitude;
      this.longitude = longitude;
      return this;
    }

    public Builder radiusKm(Double radiusKm) {
      this.radiusKm = radiusKm;
      return this;
    }

    public Builder startTime(Instant startTime) {
      this.startTime = startTime;
      return this;
    }

    public Builder endTime(Instant endTime) {
      this.endTime = endTime;
      return this;
    }

    public Builder skillLevel(SkillLevel skillLevel) {
      this.skillLevel = skillLevel;
      return this;
    }

    public Builder minPlayers(Integer minPlayers) {
      this.minPlayers = minPlayers;
      return this;
    }

    public Builder maxPlayers(Integer maxPlayers) {
      this.maxPlayers = maxPlayers;
      return this;
    }

    public Builder courtType(String courtType) {
      this.courtType = courtType;
      return this;
    }

    public Builder limit(int limit) {
      this.limit = limit;
      return this;
    }

    public Builder offset(int offset) {
      this.offset = offset;
      return this;
    }

    public DiscoveryFilter build() {
      return new DiscoveryFilter(
          latitude,
          longitude,
          radiusKm,
          startTime,
          endTime,
          skillLevel,
          minPlayers,
          maxPlayers,
          courtType,
          limit,
          offset);
    }
  }
}
