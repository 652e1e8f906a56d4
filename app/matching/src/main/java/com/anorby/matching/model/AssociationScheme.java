/*
 * どこで: Matching ドメインモデル
 * 何を: ユーザーごとの相性判定方針を定義する
 * なぜ: 一致を好むか相違を好むかで類似度の符号が変わるため
 */
package com.anorby.matching.model;

public enum AssociationScheme {
  SEEK_SIMILAR("similar"),
  SEEK_COMPLEMENTARY("complementary");

  private final String value;

  AssociationScheme(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /** 2 つの回答がこの方針での「一致」に当たるかを返す。 */
  public boolean agrees(Answer left, Answer right) {
    return this == SEEK_SIMILAR ? left == right : left != right;
  }

  public static AssociationScheme fromValue(String value) {
    for (AssociationScheme scheme : values()) {
      if (scheme.value.equalsIgnoreCase(value)) {
        return scheme;
      }
    }
    throw new IllegalArgumentException("unsupported association scheme: " + value);
  }
}
