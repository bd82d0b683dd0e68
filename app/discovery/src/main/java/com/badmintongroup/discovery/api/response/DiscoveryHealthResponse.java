package com.badmintongroup.discovery.api.response;

import com.badmintongroup.discovery.cache.CacheStats;
import com.badmintongroup.discovery.service.PerformanceMonitor;

public record DiscoveryHealthResponse(
    PerformanceMonitor.HealthState status,
    Double hitRate,
    Double avgQueryTimeMs,
    CacheStats cache) {

  public static DiscoveryHealthResponse of(PerformanceMonitor.HealthStatus status, CacheStats cache) {
    return new DiscoveryHealthResponse(
        status.status(), status.hitRate(), status.avgQueryTimeMs(), cache);
  }
}
