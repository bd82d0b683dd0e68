/*
 * どこで: Discovery NATS 送信
 * 何を: NATS 無効時のダミー publisher を提供する
 * なぜ: ローカル実行やテストで NATS なしでも InvalidationBus を動かすため
 */
package com.badmintongroup.discovery.nats;

import com.badmintongroup.discovery.service.RealtimePublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class NoopRealtimePublisher implements RealtimePublisher {

  private static final Logger logger = LoggerFactory.getLogger(NoopRealtimePublisher.class);

  @Override
  public void publish(String eventName, Object payload) {
    logger.debug("realtime publish skipped (nats disabled) event={}", eventName);
  }
}
