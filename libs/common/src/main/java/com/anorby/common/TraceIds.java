package com.anorby.common;

import java.time.Instant;
import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /**
   * ラウンド ID。開始時刻 (epoch 秒) を先頭に置くので、ログ上で文字列順 = 開始順になる。
   * 同一秒に 2 ラウンドは起きない前提だが、衝突回避に UUID 先頭 8 桁を付ける。
   */
  public static String newRoundId(Instant startedAt) {
    return "round-"
        + startedAt.getEpochSecond()
        + "-"
        + UUID.randomUUID().toString().substring(0, 8);
  }
}
