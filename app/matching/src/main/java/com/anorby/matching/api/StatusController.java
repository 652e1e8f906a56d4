/*
 * どこで: Matching API
 * 何を: ルートの簡易ヘルスレスポンスを返す
 * なぜ: 定期レポートやロードバランサからの疎通確認先にするため
 */
package com.anorby.matching.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  @GetMapping("/")
  public String home() {
    return "matching: ok";
  }
}
