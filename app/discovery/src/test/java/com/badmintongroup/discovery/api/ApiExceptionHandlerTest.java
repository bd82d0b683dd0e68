package com.badmintongroup.discovery.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.badmintongroup.discovery.service.DiscoveryUpstreamException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.HttpStatus;

class ApiExceptionHandlerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

  private final ApiExceptionHandler handler =
      new ApiExceptionHandler(Clock.fixed(NOW, ZoneOffset.UTC));

  @Test
  void handleValidationReturns400WithAllMessages() {
    final var response =
        handler.handleValidation(
            new DiscoveryValidationException(
                List.of("Invalid limit (1-100)", "Invalid offset (>= 0)")));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody())
        .isEqualTo(
            ApiErrorResponse.of(
                ApiErrorCode.VALIDATION_ERROR,
                "Invalid query parameters: Invalid limit (1-100); Invalid offset (>= 0)",
                NOW));
  }

  @Test
  void handleNotFoundReturns404() {
    final var response = handler.handleNotFound(new SessionNotFoundException("s1"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.getBody().error().message())
        .isEqualTo("Session not found or not available for discovery: s1");
  }

  @Test
  void handleUpstreamHidesStoreDetails() {
    final var response =
        handler.handleUpstream(
            new DiscoveryUpstreamException("count", new QueryTimeoutException("pg timeout")));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().success()).isFalse();
    assertThat(response.getBody().error().code()).isEqualTo("UPSTREAM_ERROR");
    assertThat(response.getBody().error().message()).doesNotContain("pg timeout");
  }

  @Test
  void handleRuntimeReturns500() {
    final var response = handler.handleRuntime(new RuntimeException("oops"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().error().code()).isEqualTo("INTERNAL_ERROR");
    assertThat(response.getBody().timestamp()).isEqualTo(NOW);
  }
}
