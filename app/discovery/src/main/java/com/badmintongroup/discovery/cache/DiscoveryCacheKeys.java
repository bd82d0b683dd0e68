/*
 * どこで: Discovery キャッシュ層
 * 何を: 検索条件から正規化済みのキャッシュキーを組み立てる
 * なぜ: 同じ意味の条件が常に同じキーになるよう、並び順と数値表現を固定するため
 */
package com.badmintongroup.discovery.cache;

import com.badmintongroup.discovery.model.DiscoveryFilter;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

public final class DiscoveryCacheKeys {

  public static final String DISCOVERY_PREFIX = "discovery:";
  public static final String SESSION_PREFIX = "session:";
  private static final int COORDINATE_SCALE = 4;

  private DiscoveryCacheKeys() {}

  /** フィールド名順に並べ、未指定の項目は含めない。radius は位置指定があるときだけ含める。 */
  public static String discovery(DiscoveryFilter filter) {
    final Map<String, String> fields = new TreeMap<>();
    if (filter.geoActive()) {
      fields.put("latitude", coordinate(filter.latitude()));
      fields.put("longitude", coordinate(filter.longitude()));
      fields.put("radius", number(filter.radiusKm()));
    }
    putIfPresent(fields, "startTime", filter.startTime());
    putIfPresent(fields, "endTime", filter.endTime());
    putIfPresent(fields, "skillLevel", filter.skillLevel());
    putIfPresent(fields, "minPlayers", filter.minPlayers());
    putIfPresent(fields, "maxPlayers", filter.maxPlayers());
    if (filter.courtType() != null) {
      fields.put("courtType", URLEncoder.encode(filter.courtType(), StandardCharsets.UTF_8));
    }
    fields.put("limit", Integer.toString(filter.limit()));
    fields.put("offset", Integer.toString(filter.offset()));
    return join(DISCOVERY_PREFIX, fields);
  }

  public static String session(String sessionId) {
    return SESSION_PREFIX + sessionId;
  }

  public static String popular(int limit) {
    return DISCOVERY_PREFIX + "popular:limit_" + limit;
  }

  public static String nearby(double latitude, double longitude, double radiusKm, int limit) {
    final Map<String, String> fields = new TreeMap<>();
    fields.put("latitude", coordinate(latitude));
    fields.put("longitude", coordinate(longitude));
    fields.put("radius", number(radiusKm));
    fields.put("limit", Integer.toString(limit));
    return join(DISCOVERY_PREFIX + "nearby:", fields);
  }

  static String coordinate(double value) {
    return BigDecimal.valueOf(value)
        .setScale(COORDINATE_SCALE, RoundingMode.HALF_UP)
        .stripTrailingZeros()
        .toPlainString();
  }

  static String number(double value) {
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }

  private static void putIfPresent(Map<String, String> fields, String name, Object value) {
    if (value != null) {
      fields.put(name, value.toString());
    }
  }

  private static String join(String prefix, Map<String, String> fields) {
    final StringJoiner joiner = new StringJoiner(":", prefix, "");
    fields.forEach((name, value) -> joiner.add(name + "_" + value));
    return joiner.toString();
  }
}
