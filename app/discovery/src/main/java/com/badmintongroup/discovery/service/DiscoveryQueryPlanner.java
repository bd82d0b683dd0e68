/*
 * どこで: Discovery サービス層
 * 何を: キャッシュ参照 → 粗い条件でのストア取得 → メモリ上の絞り込み → スコア順整列 を実行する
 * なぜ: SQL で表現しない条件 (距離/参加人数) をアプリ側で扱い、結果をキャッシュへ載せるため
 */
package com.badmintongroup.discovery.service;

import com.badmintongroup.discovery.api.SessionNotFoundException;
import com.badmintongroup.discovery.cache.CacheLayer;
import com.badmintongroup.discovery.cache.DiscoveryCacheKeys;
import com.badmintongroup.discovery.config.DiscoveryCacheProperties;
import com.badmintongroup.discovery.model.DiscoveryFilter;
import com.badmintongroup.discovery.model.DiscoveryResponse;
import com.badmintongroup.discovery.model.DiscoveryResult;
import com.badmintongroup.discovery.model.DiscoveryResultList;
import com.badmintongroup.discovery.model.SessionRecord;
import com.badmintongroup.discovery.repository.CoarsePredicate;
import com.badmintongroup.discovery.repository.SessionCandidateRepository;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
public class DiscoveryQueryPlanner {

  private static final Logger logger = LoggerFactory.getLogger(DiscoveryQueryPlanner.class);

  static final int SINGLE_SESSION_SCORE = 100;
  static final int POPULAR_SCORE = 90;
  static final double NEARBY_DISTANCE_WEIGHT = 50.0;
  static final int NEARBY_CANDIDATE_FACTOR = 2;

  // スコア降順、同点は開始が早い順、最後に id で安定化する
  private static final Comparator<DiscoveryResult> RANKING =
      Comparator.comparingInt(DiscoveryResult::relevanceScore)
          .reversed()
          .thenComparing(
              DiscoveryResult::scheduledAt, Comparator.nullsLast(Comparator.naturalOrder()))
          .thenComparing(DiscoveryResult::id);

  private final SessionCandidateRepository repository;
  private final CacheLayer cacheLayer;
  private final GeoFilterEngine geoFilterEngine;
  private final RelevanceScorer relevanceScorer;
  private final PerformanceMonitor performanceMonitor;
  private final DiscoveryCacheProperties cacheProperties;
  private final Clock clock;

  public DiscoveryQueryPlanner(
      SessionCandidateRepository repository,
      CacheLayer cacheLayer,
      GeoFilterEngine geoFilterEngine,
      RelevanceScorer relevanceScorer,
      PerformanceMonitor performanceMonitor,
      DiscoveryCacheProperties cacheProperties,
      Clock clock) {
    this.repository = repository;
    this.cacheLayer = cacheLayer;
    this.geoFilterEngine = geoFilterEngine;
    this.relevanceScorer = relevanceScorer;
    this.performanceMonitor = performanceMonitor;
    this.cacheProperties = cacheProperties;
    this.clock = clock;
  }

  /**
   * 役割: 検証済みフィルタで公開中のセッションを検索する。
   * 動作: キャッシュにあればそのまま返す。無ければ 1 回だけストアを引き、絞り込みとスコア付けが全て成功した後でキャッシュへ保存する。
   * 前提: filter は HTTP 境界で検証済み。totalCount は粗い条件での件数で、距離/人数での除外は反映しない。
   */
  public DiscoveryResponse discover(DiscoveryFilter filter) {
    final String key = DiscoveryCacheKeys.discovery(filter);
    final CacheLayer.Loaded<DiscoveryResponse> loaded =
        cacheLayer.getOrLoad(
            key, cacheProperties.discoveryTtl(), DiscoveryResponse.class, () -> search(filter));
    recordCacheOutcome(loaded.source());
    return loaded.value();
  }

  /** 単一セッションの詳細。距離は呼び出し元の位置ごとに計算し、キャッシュには含めない。 */
  public DiscoveryResult findSession(String sessionId, Double latitude, Double longitude) {
    final CacheLayer.Loaded<DiscoveryResult> loaded =
        cacheLayer.getOrLoad(
            DiscoveryCacheKeys.session(sessionId),
            cacheProperties.sessionTtl(),
            DiscoveryResult.class,
            () -> loadSession(sessionId));
    recordCacheOutcome(loaded.source());
    final DiscoveryResult result = loaded.value();
    if (latitude == null || longitude == null || !result.hasCoordinates()) {
      return result;
    }
    return result.withDistanceKm(
        geoFilterEngine.distanceKm(latitude, longitude, result.latitude(), result.longitude()));
  }

  /** 今後開催される公開セッションを参加人数の多い順に返す。 */
  public List<DiscoveryResult> popular(int limit) {
    final CacheLayer.Loaded<DiscoveryResultList> loaded =
        cacheLayer.getOrLoad(
            DiscoveryCacheKeys.popular(limit),
            cacheProperties.popularTtl(),
            DiscoveryResultList.class,
            () -> new DiscoveryResultList(loadPopular(limit)));
    recordCacheOutcome(loaded.source());
    return loaded.value().sessions();
  }

  /** 位置から radiusKm 以内の今後のセッションを近い順に返す。 */
  public List<DiscoveryResult> nearby(
      double latitude, double longitude, double radiusKm, int limit) {
    final CacheLayer.Loaded<DiscoveryResultList> loaded =
        cacheLayer.getOrLoad(
            DiscoveryCacheKeys.nearby(latitude, longitude, radiusKm, limit),
            cacheProperties.nearbyTtl(),
            DiscoveryResultList.class,
            () -> new DiscoveryResultList(loadNearby(latitude, longitude, radiusKm, limit)));
    recordCacheOutcome(loaded.source());
    return loaded.value().sessions();
  }

  private DiscoveryResponse search(DiscoveryFilter filter) {
    final long startedAt = System.nanoTime();
    final CoarsePredicate predicate = CoarsePredicate.from(filter);
    final List<SessionRecord> candidates =
        query(
            "findCandidates " + predicate,
            () -> repository.findCandidates(predicate, filter.limit(), filter.offset()));
    final long totalCount = query("count " + predicate, () -> repository.count(predicate));

    final List<DiscoveryResult> results = new ArrayList<>(candidates.size());
    for (SessionRecord record : candidates) {
      if (!matchesPlayerCount(record, filter) || !geoFilterEngine.withinRadius(record, filter)) {
        continue;
      }
      final Double distance = geoFilterEngine.distanceFrom(record, filter);
      results.add(
          DiscoveryResult.from(record, distance, relevanceScorer.score(record, filter, distance)));
    }
    results.sort(RANKING);

    final DiscoveryResponse response =
        new DiscoveryResponse(
            results, totalCount, filter.geoActive() ? filter.radiusKm() : null, filter);
    recordElapsed(startedAt);
    logger.debug(
        "discovery search completed candidates={} results={} totalCount={}",
        candidates.size(),
        results.size(),
        totalCount);
    return response;
  }

  private DiscoveryResult loadSession(String sessionId) {
    final SessionRecord record =
        query("findById " + sessionId, () -> repository.findById(sessionId))
            .filter(SessionRecord::isActive)
            .orElseThrow(() -> new SessionNotFoundException(sessionId));
    return DiscoveryResult.from(record, null, SINGLE_SESSION_SCORE);
  }

  private List<DiscoveryResult> loadPopular(int limit) {
    final long startedAt = System.nanoTime();
    final List<SessionRecord> records =
        query("findPopular limit=" + limit, () -> repository.findPopular(clock.instant(), limit));
    final List<DiscoveryResult> results =
        records.stream().map(record -> DiscoveryResult.from(record, null, POPULAR_SCORE)).toList();
    recordElapsed(startedAt);
    return results;
  }

  private List<DiscoveryResult> loadNearby(
      double latitude, double longitude, double radiusKm, int limit) {
    final long startedAt = System.nanoTime();
    final int candidateLimit = limit * NEARBY_CANDIDATE_FACTOR;
    final List<SessionRecord> records =
        query(
            "findUpcomingWithCoordinates limit=" + candidateLimit,
            () -> repository.findUpcomingWithCoordinates(clock.instant(), candidateLimit));
    final List<DiscoveryResult> results = new ArrayList<>();
    for (SessionRecord record : records) {
      if (!record.hasCoordinates()) {
        continue;
      }
      final double distance =
          geoFilterEngine.distanceKm(latitude, longitude, record.latitude(), record.longitude());
      if (distance > radiusKm) {
        continue;
      }
      final int score =
          (int) Math.round(Math.max(0.0, 100.0 - distance / radiusKm * NEARBY_DISTANCE_WEIGHT));
      results.add(DiscoveryResult.from(record, distance, score));
    }
    results.sort(
        Comparator.comparingDouble(DiscoveryResult::distanceKm).thenComparing(DiscoveryResult::id));
    recordElapsed(startedAt);
    return List.copyOf(results.subList(0, Math.min(limit, results.size())));
  }

  private boolean matchesPlayerCount(SessionRecord record, DiscoveryFilter filter) {
    if (filter.minPlayers() != null && record.currentPlayers() < filter.minPlayers()) {
      return false;
    }
    return filter.maxPlayers() == null || record.currentPlayers() <= filter.maxPlayers();
  }

  private <T> T query(String description, Supplier<T> call) {
    try {
      return call.get();
    } catch (DataAccessException ex) {
      logger.error("session store query failed query={}", description, ex);
      throw new DiscoveryUpstreamException(description, ex);
    }
  }

  private void recordCacheOutcome(CacheLayer.Source source) {
    if (source == CacheLayer.Source.HIT) {
      performanceMonitor.recordCacheHit();
    } else {
      performanceMonitor.recordCacheMiss();
    }
  }

  private void recordElapsed(long startedAtNanos) {
    performanceMonitor.recordQuery((System.nanoTime() - startedAtNanos) / 1_000_000L);
  }
}
