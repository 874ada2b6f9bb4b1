package dev.pldb.ranking;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure static utility computing competition ranks ("1224" ranking) for one signal.
 *
 * <p>Entities are sorted by value descending. Equal values share the rank of the first entity of
 * their group, and the next distinct value takes its own sorted position, leaving a gap: values
 * {@code [10, 10, 8, 5]} rank {@code [0, 0, 2, 3]}.
 */
final class DimensionRanker {

  private DimensionRanker() {}

  /**
   * Ranks entities on one dimension.
   *
   * @param scored entity values, in enumeration order
   * @return entity id to rank (0 = best), in sorted order; empty for empty input
   */
  static Map<String, Integer> rank(List<ScoredEntity> scored) {
    Map<String, Integer> ranks = new LinkedHashMap<>();
    if (scored.isEmpty()) {
      return ranks;
    }

    List<ScoredEntity> sorted = new ArrayList<>(scored);
    sorted.sort(Comparator.comparingDouble(ScoredEntity::value).reversed());

    double lastValue = sorted.get(0).value();
    int lastRank = 0;
    for (int position = 0; position < sorted.size(); position++) {
      ScoredEntity entity = sorted.get(position);
      if (Double.compare(entity.value(), lastValue) != 0) {
        lastValue = entity.value();
        lastRank = position;
      }
      ranks.put(entity.entityId(), lastRank);
    }
    return ranks;
  }
}
