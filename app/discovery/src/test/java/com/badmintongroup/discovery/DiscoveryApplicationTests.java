/*
 * どこで: Discovery アプリのスモークテスト
 * 何を: Spring コンテキストの起動と主要 Bean の配線を確認する
 * なぜ: NATS 無効時でもキャッシュ破棄と検索の経路が組み上がることを担保するため
 */
package com.badmintongroup.discovery;

import static org.assertj.core.api.Assertions.assertThat;

import com.badmintongroup.discovery.nats.NoopRealtimePublisher;
import com.badmintongroup.discovery.service.RealtimePublisher;
import com.badmintongroup.discovery.worker.CacheSweepWorker;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class DiscoveryApplicationTests extends AbstractPostgresContainerTest {

  @Autowired private ApplicationContext context;

  @Test
  void contextLoadsWithNatsDisabled() {
    assertThat(context.getBean(RealtimePublisher.class)).isInstanceOf(NoopRealtimePublisher.class);
    assertThat(context.getBeansOfType(CacheSweepWorker.class)).isEmpty();
  }
}
