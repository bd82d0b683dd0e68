package com.badmintongroup.discovery.service;

import com.badmintongroup.discovery.cache.CacheLayer;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
public class DiscoveryMetrics {

  static final String METRIC_CACHE_REQUESTS = "discovery.cache.requests";
  static final String METRIC_CACHE_ENTRIES = "discovery.cache.entries";
  static final String METRIC_CACHE_EVICTIONS = "discovery.cache.evictions";
  static final String METRIC_QUERY_DURATION = "discovery.query.duration";
  static final String METRIC_QUERY_SLOW = "discovery.query.slow.total";
  static final String METRIC_INVALIDATION = "discovery.invalidation.total";
  static final String METRIC_REALTIME_PUBLISH = "discovery.realtime.publish.total";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "MeterRegistry は Spring 管理の共有コンポーネントで、防御的コピーが不可能なため")
  private final MeterRegistry meterRegistry;

  private final Timer queryTimer;
  private final Counter slowQueryCounter;
  private final ConcurrentMap<String, Counter> cacheRequestCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> invalidationCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> publishCounters = new ConcurrentHashMap<>();

  public DiscoveryMetrics(MeterRegistry meterRegistry, CacheLayer cacheLayer) {
    this.meterRegistry = meterRegistry;
    this.queryTimer =
        Timer.builder(METRIC_QUERY_DURATION)
            .description("Discovery store query + refinement latency on cache miss")
            .register(meterRegistry);
    this.slowQueryCounter = Counter.builder(METRIC_QUERY_SLOW).register(meterRegistry);
    Gauge.builder(METRIC_CACHE_ENTRIES, cacheLayer, layer -> layer.stats().entries())
        .register(meterRegistry);
    FunctionCounter.builder(METRIC_CACHE_EVICTIONS, cacheLayer, layer -> layer.stats().evictions())
        .register(meterRegistry);
  }

  /** result は hit / miss。 */
  public void recordCacheRequest(String result) {
    cacheRequestCounters
        .computeIfAbsent(result, value -> registerCounter(METRIC_CACHE_REQUESTS, "result", value))
        .increment();
  }

  public void recordQuery(Duration duration) {
    if (duration.isNegative()) {
      return;
    }
    queryTimer.record(duration);
  }

  public void recordSlowQuery() {
    slowQueryCounter.increment();
  }

  /** scope は all / session。 */
  public void recordInvalidation(String scope) {
    invalidationCounters
        .computeIfAbsent(scope, value -> registerCounter(METRIC_INVALIDATION, "scope", value))
        .increment();
  }

  /** result は success / failure。 */
  public void recordRealtimePublish(String result) {
    publishCounters
        .computeIfAbsent(result, value -> registerCounter(METRIC_REALTIME_PUBLISH, "result", value))
        .increment();
  }

  private Counter registerCounter(String name, String tagKey, String tagValue) {
    return Counter.builder(name).tags(Tags.of(tagKey, tagValue)).register(meterRegistry);
  }
}
