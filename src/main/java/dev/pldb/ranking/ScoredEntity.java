package dev.pldb.ranking;

/**
 * One entity's value on a single ranking dimension. Input to {@link DimensionRanker}.
 *
 * @param entityId the entity
 * @param value the signal value; higher is better
 */
record ScoredEntity(String entityId, double value) {}
