/*
 * どこで: Discovery NATS 送信
 * 何を: リアルタイム通知を JSON で JetStream へ publish する
 * なぜ: WebSocket ゲートウェイ等がクライアントへ中継できるようにするため
 */
package com.badmintongroup.discovery.nats;

import com.badmintongroup.common.TraceIds;
import com.badmintongroup.discovery.config.DiscoveryNatsProperties;
import com.badmintongroup.discovery.service.RealtimePublisher;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.util.UUID;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsRealtimePublisher implements RealtimePublisher {

  static final String HEADER_MSG_ID = "Nats-Msg-Id";
  static final String HEADER_EVENT = "Discovery-Event";
  static final String HEADER_TRACE_ID = "trace_id";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "JetStream は NATS 接続に紐づく共有リソースで、防御的コピーが不可能なため")
  private final JetStream jetStream;

  private final DiscoveryNatsProperties properties;
  private final ObjectMapper objectMapper;

  public NatsRealtimePublisher(
      JetStream jetStream, DiscoveryNatsProperties properties, ObjectMapper objectMapper) {
    this.jetStream = jetStream;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public void publish(String eventName, Object payload) {
    if (eventName == null || eventName.isBlank()) {
      throw new IllegalArgumentException("eventName is required");
    }
    final byte[] body;
    try {
      body = objectMapper.writeValueAsBytes(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize realtime event " + eventName, ex);
    }
    final Headers headers = new Headers();
    headers.add(HEADER_MSG_ID, UUID.randomUUID().toString());
    headers.add(HEADER_EVENT, eventName);
    headers.add(HEADER_TRACE_ID, TraceIds.currentOrNew());
    try {
      jetStream.publish(subjectFor(eventName), headers, body);
    } catch (IOException | JetStreamApiException ex) {
      throw new IllegalStateException("failed to publish realtime event " + eventName, ex);
    }
  }

  /** discovery:session-created は &lt;prefix&gt;.discovery.session-created へ送る。 */
  String subjectFor(String eventName) {
    return properties.realtimeSubjectPrefix() + "." + eventName.replace(':', '.');
  }
}
