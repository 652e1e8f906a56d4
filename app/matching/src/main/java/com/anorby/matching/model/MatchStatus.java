/*
 * どこで: Matching ドメインモデル
 * 何を: マッチングラウンドの実行状態を定義する
 * なぜ: 同時に 1 ラウンドだけを走らせる状態遷移を列挙型で固定するため
 */
package com.anorby.matching.model;

public enum MatchStatus {
  IDLE,
  RUNNING
}
