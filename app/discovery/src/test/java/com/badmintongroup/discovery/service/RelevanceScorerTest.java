package com.badmintongroup.discovery.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.badmintongroup.discovery.model.DiscoveryFilter;
import com.badmintongroup.discovery.model.SessionRecord;
import com.badmintongroup.discovery.model.SkillLevel;
import com.badmintongroup.discovery.support.SessionRecords;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class RelevanceScorerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

  private final RelevanceScorer scorer =
      new RelevanceScorer(Clock.fixed(NOW, ZoneOffset.UTC));

  @Test
  void fullSessionScoresTenLowerThanOneWithRoom() {
    // スキル不一致 (-10) で上限 100 に張り付かない状態を作る
    final DiscoveryFilter filter =
        DiscoveryFilter.builder().skillLevel(SkillLevel.ADVANCED).build();
    final SessionRecord base =
        SessionRecords.active("a", null, null, NOW.plus(Duration.ofDays(3)), SkillLevel.BEGINNER);
    final SessionRecord full = SessionRecords.withPlayers(base, 8, 8);
    final SessionRecord open = SessionRecords.withPlayers(base, 2, 8);

    assertThat(scorer.score(open, filter, null) - scorer.score(full, filter, null)).isEqualTo(10);
  }

  @Test
  void availabilityThresholdIsExclusiveAtEightyPercent() {
    final DiscoveryFilter filter =
        DiscoveryFilter.builder().skillLevel(SkillLevel.ADVANCED).build();
    final SessionRecord base =
        SessionRecords.active("a", null, null, NOW.plus(Duration.ofDays(3)), SkillLevel.BEGINNER);

    assertThat(scorer.score(SessionRecords.withPlayers(base, 8, 10), filter, null)).isEqualTo(90);
    assertThat(scorer.score(SessionRecords.withPlayers(base, 7, 10), filter, null)).isEqualTo(100);
  }

  @Test
  void distanceTermScalesWithRemainingRadius() {
    final DiscoveryFilter filter =
        DiscoveryFilter.builder().position(0.0, 0.0).radiusKm(10.0).build();
    final SessionRecord full =
        SessionRecords.withPlayers(
            SessionRecords.active("a", 0.0, 0.0, NOW.plus(Duration.ofDays(3)), null), 8, 8);

    assertThat(scorer.score(full, filter, 0.0)).isEqualTo(100);
    assertThat(scorer.score(full, filter, 5.0)).isEqualTo(80);
    assertThat(scorer.score(full, filter, 10.0)).isEqualTo(60);
  }

  @Test
  void pastSessionsArePenalizedOnlyWhenTimeWindowIsGiven() {
    final SessionRecord past =
        SessionRecords.withPlayers(
            SessionRecords.active("a", null, null, NOW.minus(Duration.ofHours(1)), null), 8, 8);
    final DiscoveryFilter withWindow =
        DiscoveryFilter.builder().startTime(NOW.minus(Duration.ofDays(1))).build();

    assertThat(scorer.score(past, withWindow, null)).isEqualTo(70);
    assertThat(scorer.score(past, DiscoveryFilter.builder().build(), null)).isEqualTo(100);
  }

  @Test
  void soonSessionBonusIsClampedToHundred() {
    final SessionRecord soon =
        SessionRecords.active("a", null, null, NOW.plus(Duration.ofHours(2)), null);
    final DiscoveryFilter withWindow =
        DiscoveryFilter.builder().endTime(NOW.plus(Duration.ofDays(2))).build();

    assertThat(scorer.score(soon, withWindow, null)).isEqualTo(100);
  }

  @Test
  void soonWindowIncludesExactlyTwentyFourHoursAhead() {
    final DiscoveryFilter filter =
        DiscoveryFilter.builder().startTime(NOW).skillLevel(SkillLevel.ADVANCED).build();
    final SessionRecord atBoundary =
        SessionRecords.withPlayers(
            SessionRecords.active(
                "a", null, null, NOW.plus(Duration.ofHours(24)), SkillLevel.BEGINNER),
            8,
            8);
    final SessionRecord justAfter =
        SessionRecords.withPlayers(
            SessionRecords.active(
                "b",
                null,
                null,
                NOW.plus(Duration.ofHours(24)).plusSeconds(1),
                SkillLevel.BEGINNER),
            8,
            8);

    assertThat(scorer.score(atBoundary, filter, null)).isEqualTo(100);
    assertThat(scorer.score(justAfter, filter, null)).isEqualTo(90);
  }

  @Test
  void scoreStaysWithinBoundsForWorstCase() {
    final DiscoveryFilter filter =
        DiscoveryFilter.builder()
            .position(0.0, 0.0)
            .radiusKm(1.0)
            .startTime(NOW.minus(Duration.ofDays(2)))
            .skillLevel(SkillLevel.ADVANCED)
            .build();
    final SessionRecord worst =
        SessionRecords.withPlayers(
            SessionRecords.active(
                "a", 0.0, 0.009, NOW.minus(Duration.ofDays(1)), SkillLevel.BEGINNER),
            8,
            8);

    final int score = scorer.score(worst, filter, 1.0);

    assertThat(score).isBetween(0, 100).isEqualTo(20);
  }
}
