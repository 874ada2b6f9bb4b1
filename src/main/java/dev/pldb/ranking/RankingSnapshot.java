package dev.pldb.ranking;

import dev.pldb.signal.Signals;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything derived from one revision of the record set: per-entity signals and the global and
 * language-only indices. Immutable; replaced wholesale when the record set changes.
 *
 * @param revision the record set revision the snapshot was computed from
 * @param signals entity id to signals, in enumeration order
 * @param global index over every entity
 * @param language index over the language entities
 */
public record RankingSnapshot(
    long revision, Map<String, Signals> signals, RankIndex global, RankIndex language) {

  public RankingSnapshot {
    signals = Collections.unmodifiableMap(new LinkedHashMap<>(signals));
  }

  public RankIndex index(RankScope scope) {
    return switch (scope) {
      case GLOBAL -> global;
      case LANGUAGE -> language;
    };
  }

  public boolean contains(String entityId) {
    return signals.containsKey(entityId);
  }

  public long totalFactCount() {
    return signals.values().stream().mapToLong(Signals::facts).sum();
  }
}
