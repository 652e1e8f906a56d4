/*
 * どこで: Matching API
 * 何を: リクエスト妥当性エラーを表現する
 * なぜ: バリデーション失敗を 400 へ正規化するため
 */
package com.anorby.matching.api;

public class InvalidMatchingRequestException extends RuntimeException {
  public InvalidMatchingRequestException(String message) {
    super(message);
  }
}
