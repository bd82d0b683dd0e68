package com.badmintongroup.discovery.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * キャッシュのバックエンド。
 *
 * <p>実装はスレッドセーフであること。失敗は RuntimeException で通知してよく、呼び出し側の {@link
 * CacheLayer} がミス扱いに落とす。
 */
public interface CacheStore {

  /** 有効な値を返し、参照順を更新する。期限切れの値は削除して空を返す。 */
  Optional<CacheEntry> get(String key);

  /**
   * 値を保存する。ttl が 0 以下なら保存しない。
   *
   * @return 容量超過で追い出したエントリ数
   */
  int put(String key, Object value, Duration ttl);

  boolean remove(String key);

  int removeByPrefix(String prefix);

  int removeExpired();

  int size();
}
