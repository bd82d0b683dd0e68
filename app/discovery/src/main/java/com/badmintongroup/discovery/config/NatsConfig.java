/*
 * どこで: Discovery インフラ設定
 * 何を: NATS Connection と JetStream を Spring 管理下に置く
 * なぜ: publisher と subscriber が同一接続を再利用し、通知用 stream を起動時に用意するため
 */
package com.badmintongroup.discovery.config;

import com.badmintongroup.discovery.nats.JetStreamStreams;
import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.Nats;
import io.nats.client.Options;
import io.nats.client.api.StreamConfiguration;
import java.io.IOException;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsConfig {

  @Bean(destroyMethod = "close")
  public Connection natsConnection(NatsProperties properties)
      throws IOException, InterruptedException {
    final Options options =
        new Options.Builder()
            .server(properties.url())
            .connectionTimeout(Duration.ofSeconds(properties.connectionTimeout()))
            .build();
    return Nats.connect(options);
  }

  @Bean
  public JetStream jetStream(Connection natsConnection, DiscoveryNatsProperties properties)
      throws IOException, JetStreamApiException {
    final StreamConfiguration realtimeStream =
        StreamConfiguration.builder()
            .name(properties.realtimeStream())
            .subjects(properties.realtimeSubjectPrefix() + ".>")
            .duplicateWindow(properties.duplicateWindow())
            .build();
    JetStreamStreams.upsert(natsConnection.jetStreamManagement(), realtimeStream);
    return natsConnection.jetStream();
  }
}
