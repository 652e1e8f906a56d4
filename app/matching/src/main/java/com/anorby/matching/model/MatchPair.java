package com.anorby.matching.model;

import java.util.Comparator;

/** 無向ペア。userId &lt;= partnerId に正規化して扱う。 */
public record MatchPair(long userId, long partnerId) {

  public static final Comparator<MatchPair> ORDER =
      Comparator.comparingLong(MatchPair::userId).thenComparingLong(MatchPair::partnerId);

  public static MatchPair canonical(long left, long right) {
    return left <= right ? new MatchPair(left, right) : new MatchPair(right, left);
  }

  public boolean contains(long id) {
    return userId == id || partnerId == id;
  }
}
