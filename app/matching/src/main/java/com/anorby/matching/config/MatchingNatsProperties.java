/*
 * どこで: Matching 設定
 * 何を: ラウンド完了イベントの publish 先を保持する
 * なぜ: subject/stream の運用切り替えを容易にするため
 */
package com.anorby.matching.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "matching.nats")
public record MatchingNatsProperties(
    @NotBlank String subject, @NotBlank String stream, @NotNull Duration duplicateWindow) {

  public MatchingNatsProperties {
    subject = subject == null ? "matching.events" : subject;
    stream = stream == null ? "MATCHING_EVENTS" : stream;
    duplicateWindow = duplicateWindow == null ? Duration.ofMinutes(2) : duplicateWindow;
  }

  @AssertTrue(message = "matching.nats.duplicate-window must be positive")
  public boolean isDuplicateWindowPositive() {
    return duplicateWindow != null && !duplicateWindow.isZero() && !duplicateWindow.isNegative();
  }
}
