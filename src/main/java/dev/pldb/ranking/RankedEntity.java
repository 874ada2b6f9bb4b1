package dev.pldb.ranking;

/**
 * An entity's place in one scope's ordering.
 *
 * @param entityId the entity
 * @param index dense position in the ordering, 0 = best
 * @param explanation the dimension ranks and composite rank behind the position
 */
public record RankedEntity(String entityId, int index, RankExplanation explanation) {}
