/*
 * どこで: Discovery サービス層
 * 何を: 距離/時間/スキル/空き状況から 0..100 の関連度を算出する
 * なぜ: 検索結果を利用者にとって参加しやすい順に並べるため
 */
package com.badmintongroup.discovery.service;

import com.badmintongroup.discovery.model.DiscoveryFilter;
import com.badmintongroup.discovery.model.SessionRecord;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RelevanceScorer {

  static final double BASE_SCORE = 100.0;
  static final double DISTANCE_WEIGHT = 40.0;
  static final double PAST_SESSION_PENALTY = 30.0;
  static final double SOON_BONUS = 10.0;
  static final double SKILL_MATCH_BONUS = 20.0;
  static final double SKILL_MISMATCH_PENALTY = 10.0;
  static final double AVAILABILITY_BONUS = 10.0;
  static final double AVAILABILITY_THRESHOLD = 0.8;
  static final Duration SOON_WINDOW = Duration.ofHours(24);

  private final Clock clock;

  public int score(SessionRecord record, DiscoveryFilter filter, Double distanceKm) {
    double score = BASE_SCORE;
    if (filter.geoActive() && distanceKm != null) {
      final double radius = filter.radiusKm();
      final double closeness = Math.max(0.0, (radius - distanceKm) / radius);
      score -= DISTANCE_WEIGHT * (1 - closeness);
    }
    if (filter.timeWindowActive() && record.scheduledAt() != null) {
      final Instant now = clock.instant();
      if (record.scheduledAt().isBefore(now)) {
        score -= PAST_SESSION_PENALTY;
      } else if (!record.scheduledAt().isAfter(now.plus(SOON_WINDOW))) {
        score += SOON_BONUS;
      }
    }
    if (filter.skillLevel() != null && record.skillLevel() != null) {
      score +=
          filter.skillLevel() == record.skillLevel()
              ? SKILL_MATCH_BONUS
              : -SKILL_MISMATCH_PENALTY;
    }
    if (record.maxPlayers() > 0
        && (double) record.currentPlayers() / record.maxPlayers() < AVAILABILITY_THRESHOLD) {
      score += AVAILABILITY_BONUS;
    }
    return (int) Math.round(Math.max(0.0, Math.min(BASE_SCORE, score)));
  }
}
