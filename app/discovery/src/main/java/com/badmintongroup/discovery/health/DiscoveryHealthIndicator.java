package com.badmintongroup.discovery.health;

import com.badmintongroup.discovery.cache.CacheLayer;
import com.badmintongroup.discovery.cache.CacheStats;
import com.badmintongroup.discovery.service.PerformanceMonitor;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * キャッシュ命中率とクエリ時間を actuator の health に載せる。
 *
 * <p>CRITICAL でもプロセス自体は応答可能なため DOWN にはせず DEGRADED として返す。
 */
@Component("discovery")
public class DiscoveryHealthIndicator implements HealthIndicator {

  static final Status DEGRADED = new Status("DEGRADED");

  private final PerformanceMonitor performanceMonitor;
  private final CacheLayer cacheLayer;

  public DiscoveryHealthIndicator(PerformanceMonitor performanceMonitor, CacheLayer cacheLayer) {
    this.performanceMonitor = performanceMonitor;
    this.cacheLayer = cacheLayer;
  }

  @Override
  public Health health() {
    final PerformanceMonitor.HealthStatus status = performanceMonitor.healthStatus();
    final CacheStats stats = cacheLayer.stats();
    final Map<String, Object> details = new LinkedHashMap<>();
    details.put("state", status.status().name());
    // サンプルの無い指標は載せない
    if (status.hitRate() != null) {
      details.put("hitRate", status.hitRate());
    }
    if (status.avgQueryTimeMs() != null) {
      details.put("avgQueryTimeMs", status.avgQueryTimeMs());
    }
    details.put("cacheEntries", stats.entries());
    details.put("cacheEvictions", stats.evictions());
    final Health.Builder builder =
        status.status() == PerformanceMonitor.HealthState.CRITICAL
            ? Health.status(DEGRADED)
            : Health.up();
    return builder.withDetails(details).build();
  }
}
