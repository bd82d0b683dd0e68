/*
 * どこで: Discovery キャッシュ層
 * 何を: ストアの前段でヒット/ミス/追い出しを数え、同一キーの同時ミスを 1 回のロードにまとめる
 * なぜ: キャッシュ障害で検索を止めず、パージ前に計算した古い結果を書き戻さないため
 */
package com.badmintongroup.discovery.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CacheLayer {

  private static final Logger logger = LoggerFactory.getLogger(CacheLayer.class);

  /** getOrLoad の値がどこから来たか。 */
  public enum Source {
    HIT,
    LOADED,
    COALESCED
  }

  public record Loaded<T>(T value, Source source) {}

  private record InFlight(CompletableFuture<Object> future) {}

  private final CacheStore store;
  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();
  private final AtomicLong evictions = new AtomicLong();
  private final ConcurrentMap<String, InFlight> inflight = new ConcurrentHashMap<>();
  // パージと「ロード結果の書き戻し」を直列化する
  private final ReentrantLock writeGate = new ReentrantLock();

  public CacheLayer(CacheStore store) {
    this.store = store;
  }

  public <T> Optional<T> get(String key, Class<T> type) {
    final Optional<CacheEntry> entry;
    try {
      entry = store.get(key);
    } catch (RuntimeException ex) {
      logger.warn("cache get failed, treating as miss key={}", key, ex);
      misses.incrementAndGet();
      return Optional.empty();
    }
    if (entry.isPresent() && type.isInstance(entry.get().value())) {
      hits.incrementAndGet();
      return Optional.of(type.cast(entry.get().value()));
    }
    misses.incrementAndGet();
    return Optional.empty();
  }

  public void set(String key, Object value, Duration ttl) {
    try {
      final int evicted = store.put(key, value, ttl);
      if (evicted > 0) {
        evictions.addAndGet(evicted);
        logger.debug("cache evicted entries count={} key={}", evicted, key);
      }
    } catch (RuntimeException ex) {
      logger.warn("cache set failed key={}", key, ex);
    }
  }

  public void delete(String key) {
    writeGate.lock();
    try {
      inflight.remove(key);
      store.remove(key);
    } catch (RuntimeException ex) {
      logger.warn("cache delete failed key={}", key, ex);
    } finally {
      writeGate.unlock();
    }
  }

  /**
   * prefix に一致するエントリを削除し、同じ prefix で実行中のロードを切り離す。
   *
   * <p>切り離されたロードの結果は待機中の呼び出し元には返るが、キャッシュには保存されない。
   *
   * @return 削除したエントリ数。ストア障害時は 0
   */
  public int deleteByPrefix(String prefix) {
    writeGate.lock();
    try {
      inflight.keySet().removeIf(key -> key.startsWith(prefix));
      return store.removeByPrefix(prefix);
    } catch (RuntimeException ex) {
      logger.warn("cache delete by prefix failed prefix={}", prefix, ex);
      return 0;
    } finally {
      writeGate.unlock();
    }
  }

  public int removeExpired() {
    try {
      return store.removeExpired();
    } catch (RuntimeException ex) {
      logger.warn("cache expiry sweep failed", ex);
      return 0;
    }
  }

  public CacheStats stats() {
    int size;
    try {
      size = store.size();
    } catch (RuntimeException ex) {
      logger.warn("cache size lookup failed", ex);
      size = 0;
    }
    return CacheStats.of(hits.get(), misses.get(), evictions.get(), size);
  }

  /**
   * キャッシュを引き、ミスなら loader を実行して保存する。
   *
   * <p>同一キーの同時ミスは最初の 1 件だけが loader を実行し、残りはその結果を共有する。loader の例外はキャッシュに保存されず、待機中の全呼び出し元へ伝播する。
   */
  public <T> Loaded<T> getOrLoad(String key, Duration ttl, Class<T> type, Supplier<T> loader) {
    final Optional<T> cached = get(key, type);
    if (cached.isPresent()) {
      return new Loaded<>(cached.get(), Source.HIT);
    }
    final InFlight mine = new InFlight(new CompletableFuture<>());
    final InFlight existing = inflight.putIfAbsent(key, mine);
    if (existing != null) {
      return new Loaded<>(type.cast(await(existing.future())), Source.COALESCED);
    }
    // 直前のローダーが set してから in-flight を外すまでの間にミスした場合は保存済みの値を使う
    final Optional<T> stored = peek(key, type);
    if (stored.isPresent()) {
      inflight.remove(key, mine);
      mine.future().complete(stored.get());
      return new Loaded<>(stored.get(), Source.HIT);
    }
    final T value;
    try {
      value = loader.get();
    } catch (RuntimeException | Error ex) {
      inflight.remove(key, mine);
      mine.future().completeExceptionally(ex);
      throw ex;
    }
    writeGate.lock();
    try {
      // パージで切り離されていなければ保存する
      if (inflight.remove(key, mine)) {
        set(key, value, ttl);
      } else {
        logger.debug("discarding load result detached by purge key={}", key);
      }
    } finally {
      writeGate.unlock();
    }
    mine.future().complete(value);
    return new Loaded<>(value, Source.LOADED);
  }

  /** ロード枠を得た後にストアを再確認する。ヒットなら先に数えたミスをヒットへ振り替える。 */
  private <T> Optional<T> peek(String key, Class<T> type) {
    final Optional<CacheEntry> entry;
    try {
      entry = store.get(key);
    } catch (RuntimeException ex) {
      logger.warn("cache re-check failed key={}", key, ex);
      return Optional.empty();
    }
    if (entry.isPresent() && type.isInstance(entry.get().value())) {
      hits.incrementAndGet();
      misses.decrementAndGet();
      return Optional.of(type.cast(entry.get().value()));
    }
    return Optional.empty();
  }

  private Object await(CompletableFuture<Object> future) {
    try {
      return future.join();
    } catch (CompletionException ex) {
      if (ex.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      if (ex.getCause() instanceof Error error) {
        throw error;
      }
      throw ex;
    }
  }
}
