/*
 * どこで: Matching 設定
 * 何を: NATS 接続設定を保持する
 * なぜ: publish の有効/無効や接続先を環境で切り替えるため
 */
package com.anorby.matching.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nats")
public record NatsProperties(boolean enabled, String url, Integer connectionTimeout) {

  public NatsProperties {
    url = url == null || url.isBlank() ? "nats://localhost:4222" : url;
    connectionTimeout = connectionTimeout == null ? 2 : connectionTimeout;
  }
}
