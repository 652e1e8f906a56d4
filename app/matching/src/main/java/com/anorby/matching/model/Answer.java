/*
 * どこで: Matching ドメインモデル
 * 何を: A-or-B 質問への回答値を定義する
 * なぜ: DB の 0/1 表現と型安全な列挙を対応させるため
 */
package com.anorby.matching.model;

public enum Answer {
  A(0),
  B(1);

  private final int code;

  Answer(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public Answer opposite() {
    return this == A ? B : A;
  }

  /**
   * 役割: DB に保存された 0/1 を列挙型へ変換する。
   * 動作: 0 は A、1 は B を返し、それ以外は IllegalArgumentException を送出する。
   * 前提: 未回答は行そのものが存在しないため、ここには渡らない。
   */
  public static Answer fromCode(int code) {
    for (Answer answer : values()) {
      if (answer.code == code) {
        return answer;
      }
    }
    throw new IllegalArgumentException("unsupported answer code: " + code);
  }
}
