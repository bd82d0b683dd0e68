/*
 * どこで: Discovery API
 * 何を: 生のクエリ文字列を型変換・範囲検証して DiscoveryFilter 等へ変換する
 * なぜ: 検証を HTTP 境界の 1 か所に集め、下位の層では再検証しないため
 */
package com.badmintongroup.discovery.api;

import com.badmintongroup.discovery.api.request.DiscoverySearchRequest;
import com.badmintongroup.discovery.api.request.NearbyQuery;
import com.badmintongroup.discovery.api.request.SessionLocation;
import com.badmintongroup.discovery.model.DiscoveryFilter;
import com.badmintongroup.discovery.model.SkillLevel;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class DiscoveryRequestValidator {

  static final int DEFAULT_POPULAR_LIMIT = 10;
  static final int MAX_POPULAR_LIMIT = 50;

  /**
   * 役割: GET /discovery のパラメータを DiscoveryFilter へ変換する。
   * 動作: 全フィールドを検査し、1 つでも不正があれば全件を列挙した DiscoveryValidationException を送出する。
   * 前提: 未指定 (null/空文字) は既定値または「条件なし」として扱う。
   */
  public DiscoveryFilter toFilter(DiscoverySearchRequest request) {
    final List<String> errors = new ArrayList<>();
    final Double latitude = parseLatitude(request.latitude(), errors);
    final Double longitude = parseLongitude(request.longitude(), errors);
    requirePair(request.latitude(), request.longitude(), errors);
    final Double radius = parseRadius(request.radius(), errors);
    final Instant startTime = parseInstant("startTime", request.startTime(), errors);
    final Instant endTime = parseInstant("endTime", request.endTime(), errors);
    if (startTime != null && endTime != null && startTime.isAfter(endTime)) {
      errors.add("startTime must not be after endTime");
    }
    final SkillLevel skillLevel = parseSkillLevel(request.skillLevel(), errors);
    final Integer minPlayers =
        parseInt("minPlayers", request.minPlayers(), 0, Integer.MAX_VALUE, errors);
    final Integer maxPlayers =
        parseInt("maxPlayers", request.maxPlayers(), 1, Integer.MAX_VALUE, errors);
    if (minPlayers != null && maxPlayers != null && minPlayers > maxPlayers) {
      errors.add("minPlayers must not exceed maxPlayers");
    }
    final Integer limit = parseInt("limit", request.limit(), 1, DiscoveryFilter.MAX_LIMIT, errors);
    final Integer offset = parseInt("offset", request.offset(), 0, Integer.MAX_VALUE, errors);
    throwIfInvalid(errors);

    return DiscoveryFilter.builder()
        .position(latitude, longitude)
        .radiusKm(radius)
        .startTime(startTime)
        .endTime(endTime)
        .skillLevel(skillLevel)
        .minPlayers(minPlayers)
        .maxPlayers(maxPlayers)
        .courtType(trimToNull(request.courtType()))
        .limit(limit == null ? DiscoveryFilter.DEFAULT_LIMIT : limit)
        .offset(offset == null ? 0 : offset)
        .build();
  }

  public SessionLocation toLocation(String latitude, String longitude) {
    final List<String> errors = new ArrayList<>();
    final Double lat = parseLatitude(latitude, errors);
    final Double lon = parseLongitude(longitude, errors);
    requirePair(latitude, longitude, errors);
    throwIfInvalid(errors);
    return new SessionLocation(lat, lon);
  }

  public int toPopularLimit(String limit) {
    final List<String> errors = new ArrayList<>();
    final Integer value = parseInt("limit", limit, 1, MAX_POPULAR_LIMIT, errors);
    throwIfInvalid(errors);
    return value == null ? DEFAULT_POPULAR_LIMIT : value;
  }

  public NearbyQuery toNearbyQuery(
      String latitude, String longitude, String radius, String limit) {
    final List<String> errors = new ArrayList<>();
    final Double lat = parseLatitude(latitude, errors);
    final Double lon = parseLongitude(longitude, errors);
    if (isBlank(latitude) || isBlank(longitude)) {
      errors.add("latitude and longitude are required");
    }
    final Double radiusKm = parseRadius(radius, errors);
    final Integer parsedLimit = parseInt("limit", limit, 1, DiscoveryFilter.MAX_LIMIT, errors);
    throwIfInvalid(errors);
    return new NearbyQuery(
        lat,
        lon,
        radiusKm == null ? DiscoveryFilter.DEFAULT_RADIUS_KM : radiusKm,
        parsedLimit == null ? DiscoveryFilter.DEFAULT_LIMIT : parsedLimit);
  }

  private Double parseLatitude(String raw, List<String> errors) {
    final Double value = parseDouble(raw);
    if (!isBlank(raw) && (value == null || value < -90 || value > 90)) {
      errors.add("Invalid latitude (-90 to 90)");
      return null;
    }
    return value;
  }

  private Double parseLongitude(String raw, List<String> errors) {
    final Double value = parseDouble(raw);
    if (!isBlank(raw) && (value == null || value < -180 || value > 180)) {
      errors.add("Invalid longitude (-180 to 180)");
      return null;
    }
    return value;
  }

  private Double parseRadius(String raw, List<String> errors) {
    final Double value = parseDouble(raw);
    if (!isBlank(raw)
        && (value == null || value <= 0 || value > DiscoveryFilter.MAX_RADIUS_KM)) {
      errors.add("Invalid radius (greater than 0, at most 500km)");
      return null;
    }
    return value;
  }

  private void requirePair(String latitude, String longitude, List<String> errors) {
    if (isBlank(latitude) != isBlank(longitude)) {
      errors.add("latitude and longitude must be provided together");
    }
  }

  private Instant parseInstant(String name, String raw, List<String> errors) {
    if (isBlank(raw)) {
      return null;
    }
    final String value = raw.trim();
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException ex) {
      try {
        return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
      } catch (DateTimeParseException dateEx) {
        errors.add("Invalid " + name + " (ISO-8601 expected)");
        return null;
      }
    }
  }

  private SkillLevel parseSkillLevel(String raw, List<String> errors) {
    if (isBlank(raw)) {
      return null;
    }
    try {
      return SkillLevel.fromValue(raw);
    } catch (IllegalArgumentException ex) {
      errors.add("Invalid skillLevel (BEGINNER, INTERMEDIATE, ADVANCED)");
      return null;
    }
  }

  private Integer parseInt(String name, String raw, int min, int max, List<String> errors) {
    if (isBlank(raw)) {
      return null;
    }
    final int value;
    try {
      value = Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      errors.add(rangeMessage(name, min, max));
      return null;
    }
    if (value < min || value > max) {
      errors.add(rangeMessage(name, min, max));
      return null;
    }
    return value;
  }

  private String rangeMessage(String name, int min, int max) {
    return max == Integer.MAX_VALUE
        ? "Invalid " + name + " (>= " + min + ")"
        : "Invalid " + name + " (" + min + "-" + max + ")";
  }

  private Double parseDouble(String raw) {
    if (isBlank(raw)) {
      return null;
    }
    try {
      final double value = Double.parseDouble(raw.trim());
      return Double.isFinite(value) ? value : null;
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  private void throwIfInvalid(List<String> errors) {
    if (!errors.isEmpty()) {
      throw new DiscoveryValidationException(errors);
    }
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private String trimToNull(String value) {
    return isBlank(value) ? null : value.trim();
  }
}
