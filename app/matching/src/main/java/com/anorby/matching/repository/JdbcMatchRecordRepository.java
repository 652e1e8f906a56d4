package com.anorby.matching.repository;

import static com.anorby.common.JdbcTimestampUtils.toInstant;
import static com.anorby.common.JdbcTimestampUtils.toTimestamp;

import com.anorby.matching.model.Marriage;
import com.anorby.matching.model.MatchPair;
import com.anorby.matching.model.MatchRecord;
import com.anorby.matching.model.RecencyExclusion;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class JdbcMatchRecordRepository implements MatchRecordRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public RecencyExclusion fetchRecencyExclusion(int windowDays, Instant now) {
    final Instant since = now.minus(Duration.ofDays(Math.max(0, windowDays)));
    final String sql =
        """
        SELECT user_id, target_id
        FROM matched
        WHERE matched_on > :since
        """;
    final Map<Long, Set<Long>> recent = new HashMap<>();
    jdbcTemplate.query(
        sql,
        new MapSqlParameterSource().addValue("since", toTimestamp(since)),
        rs -> {
          recent.computeIfAbsent(rs.getLong("user_id"), ignored -> new HashSet<>())
              .add(rs.getLong("target_id"));
        });
    return RecencyExclusion.of(recent);
  }

  @Override
  @Transactional
  public int persistMarriage(Marriage marriage, Instant matchedOn) {
    final List<MatchPair> pairs = marriage.pairs();
    if (pairs.isEmpty()) {
      return 0;
    }
    final Timestamp timestamp = toTimestamp(matchedOn);
    final List<SqlParameterSource> rows = new ArrayList<>(pairs.size() * 2);
    for (MatchPair pair : pairs) {
      rows.add(row(pair.userId(), pair.partnerId(), timestamp));
      rows.add(row(pair.partnerId(), pair.userId(), timestamp));
    }
    final String sql =
        """
        INSERT INTO matched (user_id, target_id, matched_on)
        VALUES (:userId, :targetId, :matchedOn)
        """;
    final int[] counts = jdbcTemplate.batchUpdate(sql, rows.toArray(new SqlParameterSource[0]));
    int inserted = 0;
    for (int count : counts) {
      // ドライバがバッチ件数を返さない場合は SUCCESS_NO_INFO (-2) になるため 1 行として数える
      inserted += count < 0 ? 1 : count;
    }
    return inserted;
  }

  @Override
  public List<MatchRecord> findByUserId(long userId, int limit) {
    final String sql =
        """
        SELECT user_id, target_id, matched_on
        FROM matched
        WHERE user_id = :userId
        ORDER BY matched_on DESC, id DESC
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRecord);
  }

  private MapSqlParameterSource row(long userId, long targetId, Timestamp matchedOn) {
    return new MapSqlParameterSource()
        .addValue("userId", userId)
        .addValue("targetId", targetId)
        .addValue("matchedOn", matchedOn);
  }

  private MatchRecord mapRecord(ResultSet rs, int rowNum) throws SQLException {
    return new MatchRecord(
        rs.getLong("user_id"), rs.getLong("target_id"), toInstant(rs.getTimestamp("matched_on")));
  }
}
