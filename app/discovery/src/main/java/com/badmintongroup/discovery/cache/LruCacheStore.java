/*
 * どこで: Discovery キャッシュのバックエンド
 * 何を: 件数上限つきの LRU + TTL ストアをプロセス内に持つ
 * なぜ: 同一条件の検索を短時間に繰り返す利用パターンでストアへの負荷を抑えるため
 */
package com.badmintongroup.discovery.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

public class LruCacheStore implements CacheStore {

  private final int maxEntries;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();
  // accessOrder=true: get/put のたびに末尾へ移動し、先頭が最も古く参照されたエントリになる
  private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);

  public LruCacheStore(int maxEntries, Clock clock) {
    if (maxEntries <= 0) {
      throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
    }
    this.maxEntries = maxEntries;
    this.clock = clock;
  }

  @Override
  public Optional<CacheEntry> get(String key) {
    lock.lock();
    try {
      final CacheEntry entry = entries.get(key);
      if (entry == null) {
        return Optional.empty();
      }
      if (entry.isExpired(clock.instant())) {
        entries.remove(key);
        return Optional.empty();
      }
      return Optional.of(entry);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int put(String key, Object value, Duration ttl) {
    lock.lock();
    try {
      if (ttl == null || ttl.isZero() || ttl.isNegative()) {
        entries.remove(key);
        return 0;
      }
      final Instant now = clock.instant();
      entries.put(key, new CacheEntry(key, value, now, now.plus(ttl)));
      if (entries.size() <= maxEntries) {
        return 0;
      }
      // 期限切れは追い出し件数に数えず先に捨てる
      removeExpiredLocked(now);
      int evicted = 0;
      final Iterator<Map.Entry<String, CacheEntry>> iterator = entries.entrySet().iterator();
      while (entries.size() > maxEntries && iterator.hasNext()) {
        iterator.next();
        iterator.remove();
        evicted++;
      }
      return evicted;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean remove(String key) {
    lock.lock();
    try {
      return entries.remove(key) != null;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int removeByPrefix(String prefix) {
    lock.lock();
    try {
      final int before = entries.size();
      entries.keySet().removeIf(key -> key.startsWith(prefix));
      return before - entries.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int removeExpired() {
    lock.lock();
    try {
      return removeExpiredLocked(clock.instant());
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  private int removeExpiredLocked(Instant now) {
    final int before = entries.size();
    entries.values().removeIf(entry -> entry.isExpired(now));
    return before - entries.size();
  }
}
