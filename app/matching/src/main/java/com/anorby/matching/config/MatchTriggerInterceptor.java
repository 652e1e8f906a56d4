/*
 * どこで: Matching Web 層
 * 何を: 全リクエストの入口でラウンド起動判定を行う
 * なぜ: トラフィックがある限り、期限到来後の最初のリクエストでラウンドを始めるため
 */
package com.anorby.matching.config;

import com.anorby.matching.state.MatchTrigger;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
@RequiredArgsConstructor
public class MatchTriggerInterceptor implements HandlerInterceptor {

  private static final Logger logger = LoggerFactory.getLogger(MatchTriggerInterceptor.class);

  private final MatchTrigger matchTrigger;
  private final Clock clock;

  /**
   * 役割: リクエスト処理の前にラウンド起動判定を行う。
   * 動作: 判定の失敗はリクエスト自体を失敗させず、WARN を残して処理を続ける。
   * 前提: ラウンド本体は別スレッドで走るため、ここではロックの取得以上に待たない。
   */
  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    try {
      matchTrigger.checkAndTrigger(Instant.now(clock));
    } catch (RuntimeException ex) {
      logger.warn("match trigger check failed path={}", request.getRequestURI(), ex);
    }
    return true;
  }
}
