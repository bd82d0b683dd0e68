/*
 * どこで: Discovery API
 * 何を: 検索/単一取得/人気/近隣/ヘルスのエンドポイントを公開する
 * なぜ: モバイルクライアントが参加できるセッションを探す入口を提供するため
 */
package com.badmintongroup.discovery.api;

import com.badmintongroup.discovery.api.request.DiscoverySearchRequest;
import com.badmintongroup.discovery.api.request.NearbyQuery;
import com.badmintongroup.discovery.api.request.SessionLocation;
import com.badmintongroup.discovery.api.response.ApiResponse;
import com.badmintongroup.discovery.api.response.DiscoveryHealthResponse;
import com.badmintongroup.discovery.cache.CacheLayer;
import com.badmintongroup.discovery.model.DiscoveryFilter;
import com.badmintongroup.discovery.model.DiscoveryResponse;
import com.badmintongroup.discovery.model.DiscoveryResult;
import com.badmintongroup.discovery.service.DiscoveryQueryPlanner;
import com.badmintongroup.discovery.service.PerformanceMonitor;
import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/discovery")
@RequiredArgsConstructor
public class DiscoveryController {

  private final DiscoveryQueryPlanner queryPlanner;
  private final DiscoveryRequestValidator requestValidator;
  private final PerformanceMonitor performanceMonitor;
  private final CacheLayer cacheLayer;
  private final Clock clock;

  @GetMapping
  public ResponseEntity<ApiResponse<DiscoveryResponse>> discover(DiscoverySearchRequest request) {
    final DiscoveryFilter filter = requestValidator.toFilter(request);
    final DiscoveryResponse response = queryPlanner.discover(filter);
    return ResponseEntity.ok(
        ApiResponse.ok(response, "Sessions discovered successfully", clock.instant()));
  }

  @GetMapping("/popular")
  public ResponseEntity<ApiResponse<List<DiscoveryResult>>> popular(
      @RequestParam(name = "limit", required = false) String limit) {
    final List<DiscoveryResult> sessions =
        queryPlanner.popular(requestValidator.toPopularLimit(limit));
    return ResponseEntity.ok(
        ApiResponse.ok(sessions, "Found " + sessions.size() + " popular sessions", clock.instant()));
  }

  @GetMapping("/nearby")
  public ResponseEntity<ApiResponse<List<DiscoveryResult>>> nearby(
      @RequestParam(name = "latitude", required = false) String latitude,
      @RequestParam(name = "longitude", required = false) String longitude,
      @RequestParam(name = "radius", required = false) String radius,
      @RequestParam(name = "limit", required = false) String limit) {
    final NearbyQuery query = requestValidator.toNearbyQuery(latitude, longitude, radius, limit);
    final List<DiscoveryResult> sessions =
        queryPlanner.nearby(query.latitude(), query.longitude(), query.radiusKm(), query.limit());
    return ResponseEntity.ok(
        ApiResponse.ok(sessions, "Found " + sessions.size() + " nearby sessions", clock.instant()));
  }

  @GetMapping("/health")
  public ResponseEntity<ApiResponse<DiscoveryHealthResponse>> health() {
    final DiscoveryHealthResponse health =
        DiscoveryHealthResponse.of(performanceMonitor.healthStatus(), cacheLayer.stats());
    return ResponseEntity.ok(ApiResponse.ok(health, "Discovery health", clock.instant()));
  }

  @GetMapping("/{sessionId}")
  public ResponseEntity<ApiResponse<DiscoveryResult>> findSession(
      @PathVariable("sessionId") String sessionId,
      @RequestParam(name = "latitude", required = false) String latitude,
      @RequestParam(name = "longitude", required = false) String longitude) {
    final SessionLocation location = requestValidator.toLocation(latitude, longitude);
    final DiscoveryResult session =
        queryPlanner.findSession(sessionId, location.latitude(), location.longitude());
    return ResponseEntity.ok(
        ApiResponse.ok(session, "Session details retrieved successfully", clock.instant()));
  }
}
