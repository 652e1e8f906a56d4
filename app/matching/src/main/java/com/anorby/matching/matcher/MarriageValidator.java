package com.anorby.matching.matcher;

import com.anorby.matching.model.Marriage;
import java.util.HashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * 永続化直前にペアリングの不変条件を検査する。
 *
 * <ul>
 *   <li>自己マッチが無い
 *   <li>相手は参加者である
 *   <li>シャドウ以外の u について m[u] = v なら m[v] = u、または v がシャドウ
 *   <li>シャドウ以外のユーザーが 2 人以上の相手になっていない
 * </ul>
 */
@Component
public class MarriageValidator {

  private final ShadowProfile shadowProfile;

  public MarriageValidator(ShadowProfile shadowProfile) {
    this.shadowProfile = shadowProfile;
  }

  public void validate(Marriage marriage) {
    final long shadowId = shadowProfile.shadowUserId();
    final Map<Long, Long> claimedBy = new HashMap<>();
    for (Map.Entry<Long, Long> entry : marriage.assignments().entrySet()) {
      final long userId = entry.getKey();
      final long partnerId = entry.getValue();
      if (userId == partnerId) {
        throw new MarriageInvariantViolationException("self match userId=" + userId);
      }
      if (!marriage.participants().contains(userId)
          || !marriage.participants().contains(partnerId)) {
        throw new MarriageInvariantViolationException(
            "assignment outside participants userId=" + userId + " partnerId=" + partnerId);
      }
      if (userId != shadowId && partnerId != shadowId) {
        final Long back = marriage.assignments().get(partnerId);
        if (back == null || back != userId) {
          throw new MarriageInvariantViolationException(
              "asymmetric match userId=" + userId + " partnerId=" + partnerId + " back=" + back);
        }
      }
      if (partnerId != shadowId) {
        final Long previous = claimedBy.put(partnerId, userId);
        if (previous != null) {
          throw new MarriageInvariantViolationException(
              "user assigned to two partners userId="
                  + partnerId
                  + " claimedBy="
                  + previous
                  + ","
                  + userId);
        }
      }
    }
  }
}
