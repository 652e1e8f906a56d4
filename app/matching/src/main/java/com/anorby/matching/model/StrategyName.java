/*
 * どこで: Matching ドメインモデル
 * 何を: 割当アルゴリズムの選択肢を定義する
 * なぜ: 設定値と AssignmentStrategy 実装の対応を列挙型で固定するため
 */
package com.anorby.matching.model;

public enum StrategyName {
  STABLE,
  LOCAL_SEARCH,
  AUTO
}
