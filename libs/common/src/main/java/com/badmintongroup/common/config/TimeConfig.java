/*
 * どこで: common の共通設定
 * 何を: UTC の Clock を Bean として公開する
 * なぜ: スコアリングや TTL 判定の「現在時刻」をテストで固定できるようにするため
 */
package com.badmintongroup.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
