package dev.pldb.ranking;

import dev.pldb.signal.Dimension;

/**
 * Per-dimension ranks of one entity in one scope, and the composite rank derived from them.
 *
 * @param jobsRank competition rank on estimated jobs
 * @param usersRank competition rank on estimated users
 * @param factsRank competition rank on fact count
 * @param inboundLinksRank competition rank on inbound references
 * @param totalRank sum of the three best dimension ranks; lower is better
 */
public record RankExplanation(
    int jobsRank, int usersRank, int factsRank, int inboundLinksRank, int totalRank) {

  public int rankOf(Dimension dimension) {
    return switch (dimension) {
      case JOBS -> jobsRank;
      case USERS -> usersRank;
      case FACTS -> factsRank;
      case INBOUND_LINKS -> inboundLinksRank;
    };
  }

  /** Single-line form shown next to a rank, e.g. {@code TotalRank: 6 Jobs: 50 Users: 1 ...}. */
  public String toDebugString() {
    return "TotalRank: "
        + totalRank
        + " "
        + Dimension.JOBS.label()
        + ": "
        + jobsRank
        + " "
        + Dimension.USERS.label()
        + ": "
        + usersRank
        + " "
        + Dimension.FACTS.label()
        + ": "
        + factsRank
        + " "
        + Dimension.INBOUND_LINKS.label()
        + ": "
        + inboundLinksRank;
  }
}
