/*
 * どこで: Discovery 設定
 * 何を: リアルタイム通知の subject 接頭辞とライフサイクル購読設定を保持する
 * なぜ: subject/stream/再配信制御を環境で調整し、起動時に妥当性を検証するため
 */
package com.badmintongroup.discovery.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "discovery.nats")
@Validated
public record DiscoveryNatsProperties(
    @NotBlank String realtimeSubjectPrefix,
    @NotBlank String realtimeStream,
    @NotBlank String lifecycleSubject,
    @NotBlank String lifecycleStream,
    @NotBlank String lifecycleDurable,
    @NotNull Duration duplicateWindow,
    @NotNull Duration ackWait,
    @NotNull @Positive Integer maxDeliver) {

  @AssertTrue(message = "discovery.nats.duplicate-window must be positive")
  public boolean isDuplicateWindowPositive() {
    return isPositiveDuration(duplicateWindow);
  }

  @AssertTrue(message = "discovery.nats.ack-wait must be positive")
  public boolean isAckWaitPositive() {
    return isPositiveDuration(ackWait);
  }

  private boolean isPositiveDuration(Duration duration) {
    // null は @NotNull で検出する
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
