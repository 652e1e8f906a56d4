/*
 * どこで: Matching ドメインモデル
 * 何を: 永続化済みマッチ 1 行 (user_id 側から見た相手) を表現する
 * なぜ: matched テーブルの双方向行と履歴 API の受け渡し構造を固定するため
 */
package com.anorby.matching.model;

import java.time.Instant;

public record MatchRecord(long userId, long targetId, Instant matchedOn) {}
