/*
 * どこで: Matching アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャン/スケジューラ有効化を行う
 * なぜ: API + ラウンド実行 + 定期レポートを単一アプリとして起動するため
 */
package com.anorby.matching;

import com.anorby.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class MatchingApplication {

  public static void main(String[] args) {
    SpringApplication.run(MatchingApplication.class, args);
  }
}
