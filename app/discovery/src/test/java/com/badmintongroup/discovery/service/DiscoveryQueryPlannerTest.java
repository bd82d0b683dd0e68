package com.badmintongroup.discovery.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.badmintongroup.discovery.api.SessionNotFoundException;
import com.badmintongroup.discovery.cache.CacheLayer;
import com.badmintongroup.discovery.cache.DiscoveryCacheKeys;
import com.badmintongroup.discovery.cache.LruCacheStore;
import com.badmintongroup.discovery.config.DiscoveryCacheProperties;
import com.badmintongroup.discovery.config.DiscoveryMonitorProperties;
import com.badmintongroup.discovery.model.DiscoveryFilter;
import com.badmintongroup.discovery.model.DiscoveryResponse;
import com.badmintongroup.discovery.model.DiscoveryResult;
import com.badmintongroup.discovery.model.DiscoveryResultList;
import com.badmintongroup.discovery.model.SessionRecord;
import com.badmintongroup.discovery.model.SessionStatus;
import com.badmintongroup.discovery.model.SkillLevel;
import com.badmintongroup.discovery.repository.CoarsePredicate;
import com.badmintongroup.discovery.repository.SessionCandidateRepository;
import com.badmintongroup.discovery.support.MutableClock;
import com.badmintongroup.discovery.support.SessionRecords;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.QueryTimeoutException;

class DiscoveryQueryPlannerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");
  private static final Instant TOMORROW = NOW.plus(Duration.ofDays(1));

  private SessionCandidateRepository repository;
  private CacheLayer cacheLayer;
  private PerformanceMonitor performanceMonitor;
  private DiscoveryQueryPlanner planner;

  @BeforeEach
  void setUp() {
    final MutableClock clock = new MutableClock(NOW);
    repository = mock(SessionCandidateRepository.class);
    cacheLayer = new CacheLayer(new LruCacheStore(100, clock));
    final DiscoveryMetrics metrics = new DiscoveryMetrics(new SimpleMeterRegistry(), cacheLayer);
    performanceMonitor =
        new PerformanceMonitor(
            new DiscoveryMonitorProperties(
                0.4,
                0.6,
                Duration.ofMillis(500),
                Duration.ofMillis(200),
                Duration.ofSeconds(1)),
            metrics);
    final DiscoveryCacheProperties cacheProperties =
        new DiscoveryCacheProperties(
            100,
            Duration.ofSeconds(300),
            Duration.ofSeconds(600),
            Duration.ofSeconds(900),
            Duration.ofSeconds(1800),
            false,
            Duration.ofMinutes(5));
    planner =
        new DiscoveryQueryPlanner(
            repository,
            cacheLayer,
            new GeoFilterEngine(),
            new RelevanceScorer(clock),
            performanceMonitor,
            cacheProperties,
            clock);
  }

  @Test
  void skillFilterIsPushedDownAndOnlyActiveSessionsReturn() {
    final SessionRecord first = SessionRecords.active("s1", null, null, TOMORROW, SkillLevel.BEGINNER);
    final SessionRecord second =
        SessionRecords.active("s2", null, null, TOMORROW.plusSeconds(60), SkillLevel.BEGINNER);
    // COMPLETED のセッションは粗い条件 (status=ACTIVE) でストア側が除外する
    when(repository.findCandidates(any(), anyInt(), anyInt())).thenReturn(List.of(first, second));
    when(repository.count(any())).thenReturn(2L);
    final DiscoveryFilter filter =
        DiscoveryFilter.builder().skillLevel(SkillLevel.BEGINNER).build();

    final DiscoveryResponse response = planner.discover(filter);

    final ArgumentCaptor<CoarsePredicate> predicate = ArgumentCaptor.forClass(CoarsePredicate.class);
    verify(repository).findCandidates(predicate.capture(), eq(20), eq(0));
    assertThat(predicate.getValue().skillLevel()).isEqualTo(SkillLevel.BEGINNER);
    assertThat(predicate.getValue().requireCoordinates()).isFalse();
    assertThat(response.sessions()).extracting(DiscoveryResult::id).containsExactly("s1", "s2");
    assertThat(response.totalCount()).isEqualTo(2L);
    assertThat(response.searchRadius()).isNull();
  }

  @Test
  void geoSearchDropsFarAndUnlocatedSessionsAndSortsByScore() {
    final SessionRecord near = SessionRecords.active("near", 40.7830, -73.9655, TOMORROW, null);
    final SessionRecord mid = SessionRecords.active("mid", 40.7589, -73.9851, TOMORROW, null);
    final SessionRecord far = SessionRecords.active("far", 41.5, -73.0, TOMORROW, null);
    final SessionRecord unlocated = SessionRecords.active("none", null, null, TOMORROW, null);
    when(repository.findCandidates(any(), anyInt(), anyInt()))
        .thenReturn(List.of(mid, far, unlocated, near));
    when(repository.count(any())).thenReturn(4L);
    final DiscoveryFilter filter =
        DiscoveryFilter.builder().position(40.7829, -73.9654).radiusKm(10.0).build();

    final DiscoveryResponse response = planner.discover(filter);

    assertThat(response.sessions()).extracting(DiscoveryResult::id).containsExactly("near", "mid");
    assertThat(response.sessions())
        .allSatisfy(result -> assertThat(result.distanceKm()).isLessThanOrEqualTo(10.0 + 1e-6));
    assertThat(response.sessions().get(0).relevanceScore())
        .isGreaterThanOrEqualTo(response.sessions().get(1).relevanceScore());
    assertThat(response.searchRadius()).isEqualTo(10.0);
    // 件数は粗い条件の件数で、距離での除外は反映しない
    assertThat(response.totalCount()).isEqualTo(4L);
  }

  @Test
  void playerCountBoundsAreAppliedInMemory() {
    final SessionRecord empty =
        SessionRecords.withPlayers(SessionRecords.active("empty", null, null, TOMORROW, null), 0, 8);
    final SessionRecord half =
        SessionRecords.withPlayers(SessionRecords.active("half", null, null, TOMORROW, null), 4, 8);
    final SessionRecord full =
        SessionRecords.withPlayers(SessionRecords.active("full", null, null, TOMORROW, null), 8, 8);
    when(repository.findCandidates(any(), anyInt(), anyInt())).thenReturn(List.of(empty, half, full));
    when(repository.count(any())).thenReturn(3L);

    final DiscoveryResponse response =
        planner.discover(DiscoveryFilter.builder().minPlayers(1).maxPlayers(6).build());

    assertThat(response.sessions()).extracting(DiscoveryResult::id).containsExactly("half");
  }

  @Test
  void tiesAreBrokenByEarlierStart() {
    final SessionRecord later = SessionRecords.active("later", null, null, TOMORROW.plusSeconds(3600), null);
    final SessionRecord earlier = SessionRecords.active("earlier", null, null, TOMORROW, null);
    when(repository.findCandidates(any(), anyInt(), anyInt())).thenReturn(List.of(later, earlier));
    when(repository.count(any())).thenReturn(2L);

    final DiscoveryResponse response = planner.discover(DiscoveryFilter.builder().build());

    assertThat(response.sessions())
        .extracting(DiscoveryResult::id)
        .containsExactly("earlier", "later");
  }

  @Test
  void secondIdenticalQueryIsServedFromCache() {
    when(repository.findCandidates(any(), anyInt(), anyInt()))
        .thenReturn(List.of(SessionRecords.active("s1", null, null, TOMORROW, null)));
    when(repository.count(any())).thenReturn(1L);
    final DiscoveryFilter filter = DiscoveryFilter.builder().courtType("indoor").build();

    final DiscoveryResponse first = planner.discover(filter);
    final DiscoveryResponse second = planner.discover(filter);

    assertThat(second).isSameAs(first);
    verify(repository, times(1)).findCandidates(any(), anyInt(), anyInt());
    assertThat(performanceMonitor.healthStatus().hitRate()).isEqualTo(0.5);
  }

  @Test
  void pagesAreFetchedWithStoreLevelOffset() {
    final SessionRecord a = SessionRecords.active("a", null, null, TOMORROW, null);
    final SessionRecord b = SessionRecords.active("b", null, null, TOMORROW.plusSeconds(60), null);
    final SessionRecord c = SessionRecords.active("c", null, null, TOMORROW.plusSeconds(120), null);
    when(repository.findCandidates(any(), eq(2), eq(0))).thenReturn(List.of(a, b));
    when(repository.findCandidates(any(), eq(2), eq(2))).thenReturn(List.of(c));
    when(repository.count(any())).thenReturn(3L);

    final DiscoveryResponse page1 = planner.discover(DiscoveryFilter.builder().limit(2).build());
    final DiscoveryResponse page2 =
        planner.discover(DiscoveryFilter.builder().limit(2).offset(2).build());

    assertThat(page1.sessions()).extracting(DiscoveryResult::id).containsExactly("a", "b");
    assertThat(page2.sessions()).extracting(DiscoveryResult::id).containsExactly("c");
  }

  @Test
  void storeFailureBecomesUpstreamErrorAndIsNotCached() {
    when(repository.findCandidates(any(), anyInt(), anyInt()))
        .thenThrow(new QueryTimeoutException("timeout"))
        .thenReturn(List.of());
    when(repository.count(any())).thenReturn(0L);
    final DiscoveryFilter filter = DiscoveryFilter.builder().build();

    assertThatThrownBy(() -> planner.discover(filter))
        .isInstanceOf(DiscoveryUpstreamException.class);

    assertThat(planner.discover(filter).sessions()).isEmpty();
    verify(repository, times(2)).findCandidates(any(), anyInt(), anyInt());
  }

  @Test
  void findSessionAddsCallerDistanceWithoutCachingIt() {
    when(repository.findById("s1"))
        .thenReturn(Optional.of(SessionRecords.active("s1", 40.7589, -73.9851, TOMORROW, null)));

    final DiscoveryResult withDistance = planner.findSession("s1", 40.7829, -73.9654);
    final DiscoveryResult withoutDistance = planner.findSession("s1", null, null);

    assertThat(withDistance.distanceKm()).isGreaterThan(3.0);
    assertThat(withDistance.relevanceScore()).isEqualTo(100);
    assertThat(withoutDistance.distanceKm()).isNull();
    verify(repository, times(1)).findById("s1");
  }

  @Test
  void findSessionRejectsInactiveOrMissingSessions() {
    when(repository.findById("done"))
        .thenReturn(
            Optional.of(
                SessionRecords.withStatus(
                    SessionRecords.active("done", null, null, TOMORROW, null),
                    SessionStatus.COMPLETED)));
    when(repository.findById("missing")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> planner.findSession("done", null, null))
        .isInstanceOf(SessionNotFoundException.class);
    assertThatThrownBy(() -> planner.findSession("missing", null, null))
        .isInstanceOf(SessionNotFoundException.class);
  }

  @Test
  void popularSessionsKeepStoreOrderWithFixedScore() {
    when(repository.findPopular(NOW, 10))
        .thenReturn(
            List.of(
                SessionRecords.active("busy", null, null, TOMORROW, null),
                SessionRecords.active("quiet", null, null, TOMORROW, null)));

    final List<DiscoveryResult> popular = planner.popular(10);

    assertThat(popular).extracting(DiscoveryResult::id).containsExactly("busy", "quiet");
    assertThat(popular).extracting(DiscoveryResult::relevanceScore).containsOnly(90);
  }

  @Test
  void popularSessionsAreCachedAsTypedList() {
    when(repository.findPopular(NOW, 5))
        .thenReturn(List.of(SessionRecords.active("busy", null, null, TOMORROW, null)));

    planner.popular(5);
    final List<DiscoveryResult> second = planner.popular(5);

    assertThat(second).extracting(DiscoveryResult::id).containsExactly("busy");
    verify(repository, times(1)).findPopular(NOW, 5);
    assertThat(cacheLayer.get(DiscoveryCacheKeys.popular(5), DiscoveryResultList.class))
        .map(DiscoveryResultList::sessions)
        .hasValueSatisfying(
            cached -> assertThat(cached).extracting(DiscoveryResult::id).containsExactly("busy"));
  }

  @Test
  void nearbySessionsAreSortedByDistanceAndCut() {
    when(repository.findUpcomingWithCoordinates(NOW, 4))
        .thenReturn(
            List.of(
                SessionRecords.active("mid", 0.0, 0.05, TOMORROW, null),
                SessionRecords.active("outside", 0.0, 1.0, TOMORROW, null),
                SessionRecords.active("close", 0.0, 0.01, TOMORROW, null),
                SessionRecords.active("edge", 0.0, 0.08, TOMORROW, null)));

    final List<DiscoveryResult> nearby = planner.nearby(0.0, 0.0, 10.0, 2);

    assertThat(nearby).extracting(DiscoveryResult::id).containsExactly("close", "mid");
    assertThat(nearby.get(0).relevanceScore()).isEqualTo(94);
    assertThat(nearby.get(1).relevanceScore()).isEqualTo(72);
  }
}
