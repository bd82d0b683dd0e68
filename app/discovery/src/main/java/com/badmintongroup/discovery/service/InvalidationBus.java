/*
 * どこで: Discovery サービス層
 * 何を: セッション変更時にキャッシュを破棄し、クライアント向けイベントを送出する
 * なぜ: 他サブシステムでの変更後に古い検索結果を返し続けないため
 */
package com.badmintongroup.discovery.service;

import com.badmintongroup.discovery.cache.CacheLayer;
import com.badmintongroup.discovery.cache.DiscoveryCacheKeys;
import com.badmintongroup.discovery.model.DiscoveryResult;
import com.badmintongroup.discovery.model.SessionRecord;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class InvalidationBus {

  private static final Logger logger = LoggerFactory.getLogger(InvalidationBus.class);
  static final int EVENT_RELEVANCE_SCORE = 100;

  private final CacheLayer cacheLayer;
  private final RealtimePublisher realtimePublisher;
  private final DiscoveryMetrics metrics;
  private final Clock clock;

  public InvalidationBus(
      CacheLayer cacheLayer,
      RealtimePublisher realtimePublisher,
      DiscoveryMetrics metrics,
      Clock clock) {
    this.cacheLayer = cacheLayer;
    this.realtimePublisher = realtimePublisher;
    this.metrics = metrics;
    this.clock = clock;
  }

  /** discovery: で始まる全エントリ (一覧/人気/近隣) を破棄する。 */
  public void purgeAll() {
    final int removed = cacheLayer.deleteByPrefix(DiscoveryCacheKeys.DISCOVERY_PREFIX);
    metrics.recordInvalidation("all");
    logger.debug("discovery cache purged removed={}", removed);
  }

  /** session:&lt;id&gt; だけを破棄する。一覧系のエントリは残る。 */
  public void purgeSession(String sessionId) {
    cacheLayer.delete(DiscoveryCacheKeys.session(sessionId));
    metrics.recordInvalidation("session");
  }

  /** 送出失敗はログに残すだけで呼び出し元へは伝播しない。 */
  public void publish(String eventName, Object payload) {
    try {
      realtimePublisher.publish(eventName, payload);
      metrics.recordRealtimePublish("success");
    } catch (RuntimeException ex) {
      metrics.recordRealtimePublish("failure");
      logger.warn("realtime publish failed event={}", eventName, ex);
    }
  }

  public void sessionCreated(SessionRecord record) {
    invalidate(record.id());
    publish(DiscoveryEvents.SESSION_CREATED, changed(record));
  }

  public void sessionUpdated(SessionRecord record) {
    invalidate(record.id());
    publish(DiscoveryEvents.SESSION_UPDATED, changed(record));
  }

  public void sessionTerminated(String sessionId, String shareCode) {
    invalidate(sessionId);
    publish(
        DiscoveryEvents.SESSION_TERMINATED,
        new DiscoveryEvents.SessionTerminated(
            new DiscoveryEvents.TerminatedSession(sessionId, shareCode), clock.instant()));
  }

  public void sessionReactivated(SessionRecord record) {
    invalidate(record.id());
    publish(DiscoveryEvents.SESSION_REACTIVATED, changed(record));
  }

  private void invalidate(String sessionId) {
    purgeSession(sessionId);
    purgeAll();
    logger.info("discovery cache invalidated sessionId={}", sessionId);
  }

  private DiscoveryEvents.SessionChanged changed(SessionRecord record) {
    return new DiscoveryEvents.SessionChanged(
        DiscoveryResult.from(record, null, EVENT_RELEVANCE_SCORE), clock.instant());
  }
}
