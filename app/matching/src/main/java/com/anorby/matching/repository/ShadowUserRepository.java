/*
 * どこで: Matching データアクセス
 * 何を: シャドウ参加者の users 行を用意する
 * なぜ: シャドウとのマッチも matched へ保存するため、外部キーの参照先が必要になる
 */
package com.anorby.matching.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ShadowUserRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * 役割: シャドウ用の users 行が無ければ作る。
   * 動作: 既に同じ ID の行があれば何もしない。新規作成した場合だけ true を返す。
   * 前提: 何度呼んでもよい。
   */
  public boolean ensureShadowUser(long shadowUserId) {
    final String sql =
        """
        INSERT INTO users (id, name, email, uuid, assoc)
        VALUES (:id, 'shadow', :email, :uuid, 'similar')
        ON CONFLICT DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", shadowUserId)
            .addValue("email", "shadow-" + shadowUserId + "@anorby.invalid")
            .addValue("uuid", "shadow-" + shadowUserId);
    return jdbcTemplate.update(sql, params) > 0;
  }
}
