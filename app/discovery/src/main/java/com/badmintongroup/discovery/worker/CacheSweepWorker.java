/*
 * どこで: Discovery Worker
 * 何を: 期限切れのキャッシュエントリを定期的に掃除する
 * なぜ: 参照されないまま残る期限切れエントリで容量を圧迫しないため
 */
package com.badmintongroup.discovery.worker;

import com.badmintongroup.discovery.cache.CacheLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "discovery.cache.sweep-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class CacheSweepWorker {

  private static final Logger logger = LoggerFactory.getLogger(CacheSweepWorker.class);

  private final CacheLayer cacheLayer;

  public CacheSweepWorker(CacheLayer cacheLayer) {
    this.cacheLayer = cacheLayer;
  }

  @Scheduled(fixedDelayString = "${discovery.cache.sweep-interval}")
  public void run() {
    try {
      final int removed = cacheLayer.removeExpired();
      if (removed > 0) {
        logger.debug("expired cache entries swept removed={}", removed);
      }
    } catch (RuntimeException ex) {
      logger.warn("cache sweep failed", ex);
    }
  }
}
