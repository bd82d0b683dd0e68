/*
 * どこで: Discovery API
 * 何を: エラー応答の標準フォーマットを定義する
 * なぜ: モバイルクライアントが success フラグと error.code で分岐できるようにするため
 */
package com.badmintongroup.discovery.api;

import java.time.Instant;

public record ApiErrorResponse(boolean success, ApiError error, Instant timestamp) {

  public record ApiError(String code, String message) {}

  public static ApiErrorResponse of(ApiErrorCode code, String message, Instant timestamp) {
    return new ApiErrorResponse(false, new ApiError(code.name(), message), timestamp);
  }
}
