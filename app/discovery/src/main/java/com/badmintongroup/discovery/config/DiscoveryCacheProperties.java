/*
 * どこで: Discovery 設定
 * 何を: キャッシュ容量/用途別 TTL/期限切れ掃除の設定を保持する
 * なぜ: 容量と鮮度のトレードオフを環境ごとに調整するため
 */
package com.badmintongroup.discovery.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "discovery.cache")
@Validated
public record DiscoveryCacheProperties(
    @NotNull @Positive Integer maxEntries,
    @NotNull Duration discoveryTtl,
    @NotNull Duration sessionTtl,
    @NotNull Duration popularTtl,
    @NotNull Duration nearbyTtl,
    boolean sweepEnabled,
    @NotNull Duration sweepInterval) {

  @AssertTrue(message = "discovery.cache.sweep-interval must be positive")
  public boolean isSweepIntervalPositive() {
    return sweepInterval != null && !sweepInterval.isZero() && !sweepInterval.isNegative();
  }

  @AssertTrue(message = "discovery.cache ttl values must not be negative")
  public boolean isTtlNotNegative() {
    // 0 は「保存しない」の意味で許容する
    return isNotNegative(discoveryTtl)
        && isNotNegative(sessionTtl)
        && isNotNegative(popularTtl)
        && isNotNegative(nearbyTtl);
  }

  private boolean isNotNegative(Duration duration) {
    return duration == null || !duration.isNegative();
  }
}
