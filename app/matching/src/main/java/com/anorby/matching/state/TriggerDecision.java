/*
 * どこで: Matching 状態管理
 * 何を: トリガー判定の結果を定義する
 * なぜ: 起動しなかった理由をログとメトリクスで区別するため
 */
package com.anorby.matching.state;

public enum TriggerDecision {
  STARTED("started"),
  ALREADY_RUNNING("already_running"),
  NOT_DUE("not_due"),
  BACKING_OFF("backing_off");

  private final String value;

  TriggerDecision(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
