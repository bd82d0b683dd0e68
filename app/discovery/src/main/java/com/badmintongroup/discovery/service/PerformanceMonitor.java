/*
 * どこで: Discovery サービス層
 * 何を: キャッシュ命中率とクエリ時間を集計し、健全性を判定する
 * なぜ: キャッシュ設定やストア性能の劣化を運用側が早期に把握するため
 */
package com.badmintongroup.discovery.service;

import com.badmintongroup.discovery.config.DiscoveryMonitorProperties;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class PerformanceMonitor {

  private static final Logger logger = LoggerFactory.getLogger(PerformanceMonitor.class);

  public enum HealthState {
    HEALTHY,
    WARNING,
    CRITICAL
  }

  /** サンプルが無い指標は null。 */
  public record HealthStatus(HealthState status, Double hitRate, Double avgQueryTimeMs) {}

  private final DiscoveryMonitorProperties properties;
  private final DiscoveryMetrics metrics;
  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();
  private final AtomicLong queryCount = new AtomicLong();
  private final AtomicLong queryTotalMillis = new AtomicLong();

  public PerformanceMonitor(DiscoveryMonitorProperties properties, DiscoveryMetrics metrics) {
    this.properties = properties;
    this.metrics = metrics;
  }

  public void recordCacheHit() {
    hits.incrementAndGet();
    metrics.recordCacheRequest("hit");
  }

  public void recordCacheMiss() {
    misses.incrementAndGet();
    metrics.recordCacheRequest("miss");
  }

  public void recordQuery(long durationMs) {
    final long duration = Math.max(0L, durationMs);
    queryCount.incrementAndGet();
    queryTotalMillis.addAndGet(duration);
    metrics.recordQuery(Duration.ofMillis(duration));
    if (duration > properties.slowQuery().toMillis()) {
      metrics.recordSlowQuery();
      logger.warn(
          "slow discovery query durationMs={} thresholdMs={}",
          duration,
          properties.slowQuery().toMillis());
    }
  }

  public HealthStatus healthStatus() {
    final Double hitRate = hitRate();
    final Double avgQueryTimeMs = averageQueryTimeMs();
    return new HealthStatus(evaluate(hitRate, avgQueryTimeMs), hitRate, avgQueryTimeMs);
  }

  private HealthState evaluate(Double hitRate, Double avgQueryTimeMs) {
    if (below(hitRate, properties.criticalHitRate())
        || above(avgQueryTimeMs, properties.criticalQueryTime())) {
      return HealthState.CRITICAL;
    }
    if (below(hitRate, properties.warningHitRate())
        || above(avgQueryTimeMs, properties.warningQueryTime())) {
      return HealthState.WARNING;
    }
    return HealthState.HEALTHY;
  }

  private boolean below(Double value, double threshold) {
    return value != null && value < threshold;
  }

  private boolean above(Double valueMs, Duration threshold) {
    return valueMs != null && valueMs > threshold.toMillis();
  }

  private Double hitRate() {
    final long hitCount = hits.get();
    final long total = hitCount + misses.get();
    return total == 0 ? null : (double) hitCount / total;
  }

  private Double averageQueryTimeMs() {
    final long count = queryCount.get();
    return count == 0 ? null : (double) queryTotalMillis.get() / count;
  }
}
