package dev.pldb.ranking;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bidirectional lookup over one scope's ordering: entity id to position and position to entity id.
 *
 * <p>Positional lookups wrap around instead of failing, so "previous" of the first entity is the
 * last one and "next" of the last is the first. Instances are immutable and safe to share.
 */
public final class RankIndex {

  private final RankScope scope;
  private final Map<String, RankedEntity> byId;
  private final List<RankedEntity> byPosition;

  private RankIndex(
      RankScope scope, Map<String, RankedEntity> byId, List<RankedEntity> byPosition) {
    this.scope = scope;
    this.byId = byId;
    this.byPosition = byPosition;
  }

  /**
   * Builds the index of an ordering.
   *
   * @param scope the scope the ordering belongs to
   * @param ordering ranked entities, element {@code i} carrying index {@code i}
   * @return the index
   * @throws IllegalArgumentException if indices are not exactly 0..N-1 in order or an id repeats
   */
  static RankIndex of(RankScope scope, List<RankedEntity> ordering) {
    Map<String, RankedEntity> byId = new LinkedHashMap<>();
    for (int position = 0; position < ordering.size(); position++) {
      RankedEntity entity = ordering.get(position);
      if (entity.index() != position) {
        throw new IllegalArgumentException(
            "Entity '" + entity.entityId() + "' has index " + entity.index() + " at " + position);
      }
      if (byId.put(entity.entityId(), entity) != null) {
        throw new IllegalArgumentException("Entity '" + entity.entityId() + "' ranked twice");
      }
    }
    return new RankIndex(
        scope,
        Collections.unmodifiableMap(byId),
        Collections.unmodifiableList(new ArrayList<>(ordering)));
  }

  public RankScope scope() {
    return scope;
  }

  public int size() {
    return byPosition.size();
  }

  public boolean isEmpty() {
    return byPosition.isEmpty();
  }

  public boolean contains(String entityId) {
    return byId.containsKey(entityId);
  }

  /**
   * Dense position of an entity, 0 = best.
   *
   * @throws ScopeMembershipException if the entity is not part of this scope
   */
  public int indexOf(String entityId) {
    return require(entityId).index();
  }

  /** The dimension ranks and composite rank of an entity in this scope. */
  public RankExplanation explain(String entityId) {
    return require(entityId).explanation();
  }

  /**
   * Entity at a position. Positions below zero wrap to the last entity; positions at or past the
   * end wrap to the first.
   *
   * @param position the requested position
   * @return the entity id at the (wrapped) position
   * @throws EmptyScopeException if the scope has no entities
   */
  public String entityAt(int position) {
    if (byPosition.isEmpty()) {
      throw new EmptyScopeException(scope);
    }
    int count = byPosition.size();
    if (position < 0) {
      position = count - 1;
    }
    if (position >= count) {
      position = 0;
    }
    return byPosition.get(position).entityId();
  }

  /**
   * Fraction of the scope ranked above the entity, in [0, 1).
   *
   * @throws EmptyScopeException if the scope has no entities
   * @throws ScopeMembershipException if the entity is not part of this scope
   */
  public double percentile(String entityId) {
    if (byPosition.isEmpty()) {
      throw new EmptyScopeException(scope);
    }
    return (double) indexOf(entityId) / byPosition.size();
  }

  /** Ids of the first {@code limit} entities of the ordering. */
  public List<String> top(int limit) {
    if (limit < 0) {
      throw new IllegalArgumentException("limit must be >= 0, got: " + limit);
    }
    return byPosition.stream().limit(limit).map(RankedEntity::entityId).toList();
  }

  /** The full ordering, best first. */
  public List<RankedEntity> ordering() {
    return byPosition;
  }

  private RankedEntity require(String entityId) {
    RankedEntity entity = byId.get(entityId);
    if (entity == null) {
      throw new ScopeMembershipException(entityId, scope);
    }
    return entity;
  }
}
