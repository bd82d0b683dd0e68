/*
 * どこで: Discovery インフラ設定
 * 何を: キャッシュストアとキャッシュ層を明示的な Bean として組み立てる
 * なぜ: 生成と破棄を Spring に任せ、プロセス全体で 1 つのキャッシュを共有するため
 */
package com.badmintongroup.discovery.config;

import com.badmintongroup.discovery.cache.CacheLayer;
import com.badmintongroup.discovery.cache.CacheStore;
import com.badmintongroup.discovery.cache.LruCacheStore;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheConfig {

  @Bean
  public CacheStore discoveryCacheStore(DiscoveryCacheProperties properties, Clock clock) {
    return new LruCacheStore(properties.maxEntries(), clock);
  }

  @Bean
  public CacheLayer discoveryCacheLayer(CacheStore discoveryCacheStore) {
    return new CacheLayer(discoveryCacheStore);
  }
}
