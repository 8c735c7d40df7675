package com.slack.netselect.logstore;

import com.slack.netselect.codec.ValueWithHits;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines per-shard value lists into one. Duplicate values have their hits summed. The result is
 * ordered by descending hits, then ascending value, and cut to the limit when one is set.
 */
public class ValuesWithHitsMerger {

  public static final Comparator<ValueWithHits> HITS_DESC_VALUE_ASC =
      Comparator.comparingLong(ValueWithHits::hits)
          .reversed()
          .thenComparing(ValueWithHits::value);

  private ValuesWithHitsMerger() {}

  /**
   * @param limit maximum number of values to return, 0 for no limit
   * @param resetHitsOnLimitExceeded zero every hit count when the limit cut the result, since the
   *     sums would no longer be global counts
   */
  public static List<ValueWithHits> merge(
      List<List<ValueWithHits>> shardValues, long limit, boolean resetHitsOnLimitExceeded) {
    Map<String, Long> hitsByValue = new LinkedHashMap<>();
    for (List<ValueWithHits> vhs : shardValues) {
      if (vhs == null) {
        continue;
      }
      for (ValueWithHits vh : vhs) {
        hitsByValue.merge(vh.value(), vh.hits(), Long::sum);
      }
    }

    List<ValueWithHits> result = new ArrayList<>(hitsByValue.size());
    hitsByValue.forEach((value, hits) -> result.add(new ValueWithHits(value, hits)));
    result.sort(HITS_DESC_VALUE_ASC);

    if (limit <= 0 || result.size() <= limit) {
      return result;
    }

    List<ValueWithHits> truncated = new ArrayList<>(result.subList(0, (int) limit));
    if (resetHitsOnLimitExceeded) {
      truncated.replaceAll(vh -> new ValueWithHits(vh.value(), 0));
    }
    return truncated;
  }
}
