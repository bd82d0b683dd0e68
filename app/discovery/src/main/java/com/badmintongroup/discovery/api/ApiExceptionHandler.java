package com.badmintongroup.discovery.api;

import com.badmintongroup.discovery.service.DiscoveryUpstreamException;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  private final Clock clock;

  public ApiExceptionHandler(Clock clock) {
    this.clock = clock;
  }

  @ExceptionHandler(DiscoveryValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(DiscoveryValidationException ex) {
    return respond(HttpStatus.BAD_REQUEST, ApiErrorCode.VALIDATION_ERROR, ex.getMessage());
  }

  @ExceptionHandler(SessionNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(SessionNotFoundException ex) {
    return respond(HttpStatus.NOT_FOUND, ApiErrorCode.NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(DiscoveryUpstreamException.class)
  public ResponseEntity<ApiErrorResponse> handleUpstream(DiscoveryUpstreamException ex) {
    // 詳細は planner 側で ERROR ログ済み
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        ApiErrorCode.UPSTREAM_ERROR,
        "Failed to discover sessions");
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled discovery api error", ex);
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR, ApiErrorCode.INTERNAL_ERROR, "Internal server error");
  }

  private ResponseEntity<ApiErrorResponse> respond(
      HttpStatus status, ApiErrorCode code, String message) {
    return ResponseEntity.status(status).body(ApiErrorResponse.of(code, message, clock.instant()));
  }
}
