package com.badmintongroup.discovery.nats;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.badmintongroup.discovery.config.DiscoveryNatsProperties;
import com.badmintongroup.discovery.service.DiscoveryEvents;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.JetStream;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.slf4j.MDC;

class NatsRealtimePublisherTest {

  private JetStream jetStream;
  private ObjectMapper objectMapper;
  private NatsRealtimePublisher publisher;

  @BeforeEach
  void setUp() {
    jetStream = Mockito.mock(JetStream.class);
    objectMapper = new ObjectMapper().findAndRegisterModules();
    final DiscoveryNatsProperties properties =
        new DiscoveryNatsProperties(
            "discovery.realtime",
            "discovery-realtime",
            "sessions.lifecycle",
            "sessions-lifecycle",
            "discovery-lifecycle-consumer",
            Duration.ofMinutes(2),
            Duration.ofSeconds(10),
            10);
    publisher = new NatsRealtimePublisher(jetStream, properties, objectMapper);
  }

  @AfterEach
  void cleanup() {
    MDC.clear();
  }

  @Test
  void publishesJsonToEventSubjectWithHeaders() throws Exception {
    MDC.put("trace_id", "trace-42");
    final DiscoveryEvents.SessionTerminated payload =
        new DiscoveryEvents.SessionTerminated(
            new DiscoveryEvents.TerminatedSession("s1", "SC1"),
            Instant.parse("2026-03-01T09:00:00Z"));

    publisher.publish(DiscoveryEvents.SESSION_TERMINATED, payload);

    final ArgumentCaptor<Headers> headers = ArgumentCaptor.forClass(Headers.class);
    final ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
    verify(jetStream)
        .publish(
            eq("discovery.realtime.discovery.session-terminated"),
            headers.capture(),
            body.capture());
    assertThat(headers.getValue().getFirst("Discovery-Event"))
        .isEqualTo("discovery:session-terminated");
    assertThat(headers.getValue().getFirst("trace_id")).isEqualTo("trace-42");
    assertThat(headers.getValue().getFirst("Nats-Msg-Id")).isNotBlank();
    final JsonNode json = objectMapper.readTree(body.getValue());
    assertThat(json.path("session").path("id").asText()).isEqualTo("s1");
    assertThat(json.path("session").path("shareCode").asText()).isEqualTo("SC1");
  }

  @Test
  void wrapsIOException() throws Exception {
    when(jetStream.publish(any(String.class), any(Headers.class), any(byte[].class)))
        .thenThrow(new IOException("boom"));

    assertThatThrownBy(() -> publisher.publish(DiscoveryEvents.SESSION_UPDATED, "payload"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("failed to publish");
  }

  @Test
  void throwsWhenEventNameMissing() {
    assertThatThrownBy(() -> publisher.publish(" ", "payload"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void noopPublisherDoesNothing() {
    new NoopRealtimePublisher().publish(DiscoveryEvents.SESSION_CREATED, "payload");
  }
}
