/*
 * どこで: Discovery データアクセス
 * 何を: ストアへ押し下げる粗い絞り込み条件を表現する
 * なぜ: 距離や参加人数のように SQL で扱わない条件と分離し、2 段階の検索を明示するため
 */
package com.badmintongroup.discovery.repository;

import com.badmintongroup.discovery.model.DiscoveryFilter;
import com.badmintongroup.discovery.model.SkillLevel;
import java.time.Instant;

/** status=ACTIVE かつ visibility=public は常に暗黙で付与される。 */
public record CoarsePredicate(
    SkillLevel skillLevel,
    String courtType,
    Instant scheduledFrom,
    Instant scheduledTo,
    boolean requireCoordinates) {

  public static CoarsePredicate from(DiscoveryFilter filter) {
    return new CoarsePredicate(
        filter.skillLevel(),
        filter.courtType(),
        filter.startTime(),
        filter.endTime(),
        filter.geoActive());
  }
}
