/*
 * どこで: Matching アルゴリズム層
 * 何を: ペアリングの不変条件違反を表現する
 * なぜ: プログラム誤りを永続化前に致命エラーとしてラウンドを失敗させるため
 */
package com.anorby.matching.matcher;

public class MarriageInvariantViolationException extends IllegalStateException {
  public MarriageInvariantViolationException(String message) {
    super(message);
  }
}
