/*
 * どこで: Matching Web 設定
 * 何を: MDC 付与とラウンド起動判定の interceptor を全リクエストへ適用する
 * なぜ: 起動判定ログにもリクエストの運用キーを載せるため、MDC を先に登録する
 */
package com.anorby.matching.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;
  private final MatchTriggerInterceptor matchTriggerInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor);
    registry.addInterceptor(matchTriggerInterceptor);
  }
}
