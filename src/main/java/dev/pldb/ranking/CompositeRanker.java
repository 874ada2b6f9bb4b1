package dev.pldb.ranking;

import dev.pldb.signal.Dimension;
import dev.pldb.signal.Signals;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Pure static utility combining the four dimension ranks of each entity into one ordering.
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>Competition-rank every dimension independently over the given entities
 *   <li>Per entity, drop its worst (largest) dimension rank and sum the other three
 *   <li>Stable-sort by that composite ascending; ties keep enumeration order
 *   <li>Assign dense indices 0..N-1 in sorted order
 * </ol>
 *
 * <p>Dropping the worst dimension keeps a single badly estimated or unresearched signal, such as
 * missing job data, from pinning an otherwise strong entity to the bottom.
 */
final class CompositeRanker {

  private CompositeRanker() {}

  /**
   * Sum of the three lowest of four dimension ranks.
   *
   * @return the composite rank; lower is better
   */
  static int compositeRank(int jobsRank, int usersRank, int factsRank, int inboundLinksRank) {
    int[] ranks = {jobsRank, usersRank, factsRank, inboundLinksRank};
    Arrays.sort(ranks);
    return ranks[0] + ranks[1] + ranks[2];
  }

  /**
   * Orders one scope.
   *
   * @param inScope signals of every entity in the scope, in enumeration order
   * @return the ordering, element {@code i} having index {@code i}
   */
  static List<RankedEntity> order(List<Signals> inScope) {
    Map<Dimension, Map<String, Integer>> dimensionRanks = new EnumMap<>(Dimension.class);
    for (Dimension dimension : Dimension.values()) {
      List<ScoredEntity> scored = new ArrayList<>(inScope.size());
      for (Signals signals : inScope) {
        scored.add(new ScoredEntity(signals.entityId(), signals.value(dimension)));
      }
      dimensionRanks.put(dimension, DimensionRanker.rank(scored));
    }

    List<Composite> composites = new ArrayList<>(inScope.size());
    for (Signals signals : inScope) {
      String id = signals.entityId();
      int jobsRank = dimensionRanks.get(Dimension.JOBS).get(id);
      int usersRank = dimensionRanks.get(Dimension.USERS).get(id);
      int factsRank = dimensionRanks.get(Dimension.FACTS).get(id);
      int linksRank = dimensionRanks.get(Dimension.INBOUND_LINKS).get(id);
      composites.add(
          new Composite(
              id,
              new RankExplanation(
                  jobsRank,
                  usersRank,
                  factsRank,
                  linksRank,
                  compositeRank(jobsRank, usersRank, factsRank, linksRank))));
    }

    // List.sort is stable: equal composites keep enumeration order
    composites.sort(Comparator.comparingInt(c -> c.explanation().totalRank()));

    List<RankedEntity> ordering = new ArrayList<>(composites.size());
    for (int index = 0; index < composites.size(); index++) {
      Composite composite = composites.get(index);
      ordering.add(new RankedEntity(composite.entityId(), index, composite.explanation()));
    }
    return ordering;
  }

  /** Internal holder for an entity before its index is known. */
  private record Composite(String entityId, RankExplanation explanation) {}
}
