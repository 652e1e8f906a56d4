package com.anorby.matching.repository;

import static com.anorby.common.JdbcTimestampUtils.toTimestamp;

import com.anorby.matching.model.Answer;
import com.anorby.matching.model.AnswerVector;
import com.anorby.matching.model.AssociationScheme;
import com.anorby.matching.model.Question;
import com.anorby.matching.model.Submission;
import com.anorby.matching.model.Submissions;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcSubmissionRepository implements SubmissionRepository {

  private static final String ELIGIBLE_USERS =
      """
      WITH eligible AS (
        SELECT aa.user_id
        FROM aorb_answers aa
        JOIN users u ON u.id = aa.user_id
        WHERE aa.user_id <> :excludedUserId
          AND aa.answer IN (0, 1)
        GROUP BY aa.user_id
        HAVING COUNT(*) FILTER (WHERE aa.answered_on >= :activeSince) >= :minAnswered
          OR COUNT(*) >= :questionCount
      )
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public Submissions fetchSubmissions(
      int minAnsweredQuestions, long excludedUserId, Instant activeSince) {
    final List<Question> questions =
        jdbcTemplate.query(
            "SELECT id, a, b, mean FROM aorb ORDER BY id",
            new MapSqlParameterSource(),
            this::mapQuestion);
    if (questions.isEmpty()) {
      return Submissions.of(List.of(), List.of());
    }
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("excludedUserId", excludedUserId)
            .addValue("minAnswered", Math.max(1, minAnsweredQuestions))
            .addValue("activeSince", toTimestamp(activeSince))
            .addValue("questionCount", questions.size())
            .addValue("defaultQuestionId", questions.get(0).id());

    final Map<Long, Map<Long, Answer>> answersByUser = new HashMap<>();
    jdbcTemplate.query(
        ELIGIBLE_USERS
            + """
            SELECT aa.user_id, aa.aorb_id, aa.answer
            FROM aorb_answers aa
            JOIN eligible e ON e.user_id = aa.user_id
            WHERE aa.answer IN (0, 1)
            """,
        params,
        rs -> {
          answersByUser
              .computeIfAbsent(rs.getLong("user_id"), ignored -> new TreeMap<>())
              .put(rs.getLong("aorb_id"), Answer.fromCode(rs.getInt("answer")));
        });

    // 主質問が未設定のユーザーは質問バンク先頭の質問で陣営を決める
    final List<Submission> submissions = new ArrayList<>();
    jdbcTemplate.query(
        ELIGIBLE_USERS
            + """
            SELECT u.id, COALESCE(u.aorb_id, :defaultQuestionId) AS aorb_id, u.assoc
            FROM users u
            JOIN eligible e ON e.user_id = u.id
            ORDER BY u.id
            """,
        params,
        rs -> {
          final long userId = rs.getLong("id");
          submissions.add(
              new Submission(
                  userId,
                  AnswerVector.of(answersByUser.getOrDefault(userId, Map.of())),
                  rs.getLong("aorb_id"),
                  toScheme(rs.getString("assoc"))));
        });
    return Submissions.of(submissions, questions);
  }

  private Question mapQuestion(ResultSet rs, int rowNum) throws SQLException {
    return new Question(rs.getLong("id"), rs.getString("a"), rs.getString("b"), rs.getDouble("mean"));
  }

  private static AssociationScheme toScheme(String value) {
    if (value == null || value.isBlank()) {
      return AssociationScheme.SEEK_SIMILAR;
    }
    return AssociationScheme.fromValue(value);
  }
}
