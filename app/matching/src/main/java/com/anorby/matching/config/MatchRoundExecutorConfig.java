/*
 * どこで: Matching アプリのインフラ設定
 * 何を: ラウンド実行専用の単一スレッド executor を定義する
 * なぜ: リクエストスレッドをラウンド計算で塞がず、同時に 2 本走らせないため
 */
package com.anorby.matching.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class MatchRoundExecutorConfig {

  @Bean(name = "matchRoundExecutor")
  public ThreadPoolTaskExecutor matchRoundExecutor() {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    // 待ち行列を持たない: 実行中に投入された場合は拒否として表面化させる
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("match-round-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }
}
