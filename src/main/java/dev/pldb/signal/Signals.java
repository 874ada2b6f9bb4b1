package dev.pldb.signal;

/**
 * The four ranking signals of one entity.
 *
 * @param entityId the entity the signals belong to
 * @param jobs estimated job openings
 * @param users estimated users
 * @param facts number of recorded facts
 * @param inboundLinks number of cross-references from other entities
 */
public record Signals(String entityId, long jobs, long users, int facts, int inboundLinks) {

  public Signals {
    if (jobs < 0 || users < 0 || facts < 0 || inboundLinks < 0) {
      throw new IllegalArgumentException(
          "Signals of '"
              + entityId
              + "' must be non-negative: jobs="
              + jobs
              + ", users="
              + users
              + ", facts="
              + facts
              + ", inboundLinks="
              + inboundLinks);
    }
  }

  public double value(Dimension dimension) {
    return switch (dimension) {
      case JOBS -> jobs;
      case USERS -> users;
      case FACTS -> facts;
      case INBOUND_LINKS -> inboundLinks;
    };
  }
}
