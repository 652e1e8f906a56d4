/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: ラウンド判定と永続化の時刻を同一の Clock から取るため
 */
package com.anorby.common.config;

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
