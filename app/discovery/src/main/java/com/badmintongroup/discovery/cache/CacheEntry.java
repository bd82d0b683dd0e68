package com.badmintongroup.discovery.cache;

import java.time.Instant;

/** 挿入時刻と失効時刻を持つキャッシュ値。参照順は {@link LruCacheStore} が管理する。 */
public record CacheEntry(String key, Object value, Instant insertedAt, Instant expiresAt) {

  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }
}
