/*
 * どこで: Matching ドメインモデル
 * 何を: A-or-B 質問と母集団平均を表現する
 * なぜ: 類似度計算で質問ごとの分散を重みに使うため
 */
package com.anorby.matching.model;

public record Question(long id, String optionA, String optionB, double mean) {

  public Question {
    if (Double.isNaN(mean)) {
      mean = 0.5;
    }
    mean = Math.max(0.0, Math.min(1.0, mean));
  }

  /** B を選ぶ割合を p としたときの p(1-p)。賛否が割れる質問ほど大きい。 */
  public double variance() {
    return mean * (1.0 - mean);
  }
}
