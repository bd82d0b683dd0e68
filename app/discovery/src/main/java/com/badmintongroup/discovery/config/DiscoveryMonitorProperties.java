/*
 * どこで: Discovery 設定
 * 何を: ヘルス判定のしきい値と遅いクエリの基準を保持する
 * なぜ: 運用の目標値をコード外で調整できるようにするため
 */
package com.badmintongroup.discovery.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "discovery.monitor")
@Validated
public record DiscoveryMonitorProperties(
    @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double criticalHitRate,
    @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double warningHitRate,
    @NotNull Duration criticalQueryTime,
    @NotNull Duration warningQueryTime,
    @NotNull Duration slowQuery) {

  @AssertTrue(message = "discovery.monitor warning thresholds must be looser than critical ones")
  public boolean isThresholdOrderValid() {
    if (criticalHitRate == null
        || warningHitRate == null
        || criticalQueryTime == null
        || warningQueryTime == null) {
      return true;
    }
    return criticalHitRate <= warningHitRate
        && warningQueryTime.compareTo(criticalQueryTime) <= 0;
  }

  @AssertTrue(message = "discovery.monitor.slow-query must be positive")
  public boolean isSlowQueryPositive() {
    return slowQuery != null && !slowQuery.isZero() && !slowQuery.isNegative();
  }
}
