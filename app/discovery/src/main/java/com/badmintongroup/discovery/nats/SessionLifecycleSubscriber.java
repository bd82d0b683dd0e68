/*
 * どこで: Discovery NATS 購読
 * 何を: Session サブシステムの変更通知を JetStream から購読する
 * なぜ: 他プロセスでのセッション変更をキャッシュ破棄とリアルタイム通知へ反映するため
 */
package com.badmintongroup.discovery.nats;

import com.badmintongroup.discovery.config.DiscoveryNatsProperties;
import com.badmintongroup.discovery.model.SessionLifecycleMessage;
import com.badmintongroup.discovery.service.SessionLifecycleEventHandler;
import com.badmintongroup.discovery.service.SessionLifecycleEventPermanentException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class SessionLifecycleSubscriber {

  private static final Logger logger = LoggerFactory.getLogger(SessionLifecycleSubscriber.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "NATS Connection は外部管理の共有リソースで、防御的コピーが不可能なため")
  private final Connection connection;

  private final SessionLifecycleEventHandler eventHandler;
  private final DiscoveryNatsProperties properties;
  private final ObjectMapper objectMapper;
  private final AtomicBoolean started;
  private Dispatcher dispatcher;
  private JetStreamSubscription subscription;

  public SessionLifecycleSubscriber(
      Connection connection,
      SessionLifecycleEventHandler eventHandler,
      DiscoveryNatsProperties properties,
      ObjectMapper objectMapper) {
    this.connection = connection;
    this.eventHandler = eventHandler;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.started = new AtomicBoolean(false);
  }

  @PostConstruct
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    try {
      JetStreamStreams.upsert(connection.jetStreamManagement(), buildStreamConfiguration());
      final JetStream jetStream = connection.jetStream();
      dispatcher = connection.createDispatcher();
      subscription =
          jetStream.subscribe(
              properties.lifecycleSubject(),
              dispatcher,
              this::handleMessage,
              false,
              buildPushSubscribeOptions());
      logger.info(
          "session lifecycle subscriber started subject={} stream={} durable={}",
          properties.lifecycleSubject(),
          properties.lifecycleStream(),
          properties.lifecycleDurable());
    } catch (IOException | JetStreamApiException ex) {
      started.set(false);
      throw new IllegalStateException("failed to start session lifecycle subscriber", ex);
    }
  }

  @PreDestroy
  public void stop() {
    if (subscription != null) {
      subscription.unsubscribe();
      subscription = null;
    }
    if (dispatcher != null) {
      connection.closeDispatcher(dispatcher);
      dispatcher = null;
    }
    started.set(false);
  }

  @VisibleForTesting
  void handleMessage(Message message) {
    try {
      final SessionLifecycleMessage payload =
          objectMapper.readValue(message.getData(), SessionLifecycleMessage.class);
      eventHandler.handle(payload);
      message.ack();
    } catch (IOException ex) {
      // 不正 JSON は再配信しても回復しない
      logger.warn(
          "failed to parse session lifecycle payload subject={}", properties.lifecycleSubject(), ex);
      message.term();
    } catch (SessionLifecycleEventPermanentException ex) {
      logger.warn("session lifecycle event rejected reason={}", ex.getMessage());
      message.term();
    } catch (DataAccessException ex) {
      logger.warn("temporary failure while handling session lifecycle event", ex);
      message.nak();
    } catch (RuntimeException ex) {
      logger.warn("failed to handle session lifecycle event", ex);
      message.nak();
    }
  }

  private StreamConfiguration buildStreamConfiguration() {
    return StreamConfiguration.builder()
        .name(properties.lifecycleStream())
        .subjects(properties.lifecycleSubject())
        .duplicateWindow(properties.duplicateWindow())
        .build();
  }

  private PushSubscribeOptions buildPushSubscribeOptions() {
    final ConsumerConfiguration consumerConfiguration =
        ConsumerConfiguration.builder()
            .ackPolicy(AckPolicy.Explicit)
            .ackWait(properties.ackWait())
            .maxDeliver(properties.maxDeliver())
            .build();
    return PushSubscribeOptions.builder()
        .stream(properties.lifecycleStream())
        .durable(properties.lifecycleDurable())
        .configuration(consumerConfiguration)
        .build();
  }
}
