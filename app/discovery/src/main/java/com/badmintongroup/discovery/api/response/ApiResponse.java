package com.badmintongroup.discovery.api.response;

import java.time.Instant;

/** 成功応答の共通エンベロープ。 */
public record ApiResponse<T>(boolean success, T data, String message, Instant timestamp) {

  public static <T> ApiResponse<T> ok(T data, String message, Instant timestamp) {
    return new ApiResponse<>(true, data, message, timestamp);
  }
}
