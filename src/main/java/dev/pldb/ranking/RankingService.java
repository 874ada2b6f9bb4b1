package dev.pldb.ranking;

import dev.pldb.record.RecordAccessor;
import dev.pldb.signal.InboundLinkCounter;
import dev.pldb.signal.SignalExtractor;
import dev.pldb.signal.Signals;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Ranking engine and its cache: owns the {@link RankingSnapshot} of the current record set.
 *
 * <p>Pipeline: invert outbound references into inbound counts -> extract the four signals of every
 * entity -> competition-rank each dimension -> drop-worst composite -> dense ordering, once for
 * all entities and once for the language subset -> forward/inverse {@link RankIndex}.
 *
 * <p>The snapshot is computed lazily on first access and then shared read-only. First population
 * is serialised by a lock so concurrent callers never build divergent snapshots. There is no
 * partial update: the composite couples every entity to every other entity in its scope, so any
 * change to the record set (seen as a new {@link RecordAccessor#revision()}) or an explicit {@link
 * #invalidate()} discards the whole snapshot. Each pass reads {@link
 * RecordAccessor#consistentView()}, so a concurrent change to the record set is picked up by the
 * next pass rather than mixed into the current one.
 */
@Service
public class RankingService {

  private static final Logger log = LoggerFactory.getLogger(RankingService.class);

  private final RecordAccessor records;
  private final SignalExtractor signalExtractor;
  private final InboundLinkCounter inboundLinkCounter;
  private final ReentrantLock populateLock = new ReentrantLock();

  private volatile @Nullable RankingSnapshot snapshot;

  public RankingService(
      RecordAccessor records,
      SignalExtractor signalExtractor,
      InboundLinkCounter inboundLinkCounter) {
    this.records = records;
    this.signalExtractor = signalExtractor;
    this.inboundLinkCounter = inboundLinkCounter;
  }

  /**
   * Dense position of an entity in a scope's ordering, 0 = best.
   *
   * @throws UnknownEntityException if the entity does not exist
   * @throws ScopeMembershipException if the entity exists but is not in the scope
   * @throws dev.pldb.signal.DanglingReferenceException if the rankings cannot be computed
   */
  public int rank(String entityId, RankScope scope) {
    RankingSnapshot current = snapshot();
    requireEntity(current, entityId);
    return current.index(scope).indexOf(entityId);
  }

  /**
   * Entity at a position of a scope's ordering, wrapping around at both ends.
   *
   * @throws EmptyScopeException if the scope has no entities
   */
  public String entityAtRank(int position, RankScope scope) {
    return snapshot().index(scope).entityAt(position);
  }

  /**
   * Global position of an entity divided by the number of entities, in [0, 1).
   *
   * @throws EmptyScopeException if the record set is empty
   * @throws UnknownEntityException if the entity does not exist
   */
  public double percentile(String entityId) {
    RankingSnapshot current = snapshot();
    if (current.global().isEmpty()) {
      throw new EmptyScopeException(RankScope.GLOBAL);
    }
    requireEntity(current, entityId);
    return current.global().percentile(entityId);
  }

  /**
   * Dimension ranks and composite rank of an entity within a scope. The same entity generally has
   * different ranks in different scopes.
   */
  public RankExplanation rankExplanation(String entityId, RankScope scope) {
    RankingSnapshot current = snapshot();
    requireEntity(current, entityId);
    return current.index(scope).explain(entityId);
  }

  /**
   * The entity ranked just above this one, wrapping to the last. Languages navigate within the
   * language ordering, everything else within the global ordering.
   */
  public String previousRanked(String entityId) {
    RankIndex index = navigationIndex(entityId);
    return index.entityAt(index.indexOf(entityId) - 1);
  }

  /** The entity ranked just below this one, wrapping to the first. */
  public String nextRanked(String entityId) {
    RankIndex index = navigationIndex(entityId);
    return index.entityAt(index.indexOf(entityId) + 1);
  }

  /** Ids of the best {@code limit} entities of a scope. */
  public List<String> topEntities(RankScope scope, int limit) {
    return snapshot().index(scope).top(limit);
  }

  /** Number of entities in a scope. */
  public int size(RankScope scope) {
    return snapshot().index(scope).size();
  }

  /** The cached signals of an entity. */
  public Signals signals(String entityId) {
    RankingSnapshot current = snapshot();
    requireEntity(current, entityId);
    return current.signals().get(entityId);
  }

  /** Sum of the fact counts of every entity. */
  public long totalFactCount() {
    return snapshot().totalFactCount();
  }

  /**
   * Returns the current snapshot, computing it if there is none or the record set has changed
   * since it was computed.
   *
   * @return the snapshot for the current record set revision
   * @throws dev.pldb.signal.DanglingReferenceException if a record references a missing entity;
   *     no snapshot is cached in that case
   */
  public RankingSnapshot snapshot() {
    RankingSnapshot current = snapshot;
    if (current != null && current.revision() == records.revision()) {
      return current;
    }
    populateLock.lock();
    try {
      current = snapshot;
      if (current == null || current.revision() != records.revision()) {
        RecordAccessor view = records.consistentView();
        if (current != null) {
          log.debug(
              "Record set moved from revision {} to {}; discarding rankings",
              current.revision(),
              view.revision());
        }
        current = compute(view);
        snapshot = current;
      }
      return current;
    } finally {
      populateLock.unlock();
    }
  }

  /** Discards the cached snapshot; the next query recomputes everything. */
  public void invalidate() {
    populateLock.lock();
    try {
      snapshot = null;
      log.debug("Rankings invalidated");
    } finally {
      populateLock.unlock();
    }
  }

  /**
   * Discards the cached snapshot and recomputes it immediately.
   *
   * @return the fresh snapshot
   */
  public RankingSnapshot reload() {
    invalidate();
    return snapshot();
  }

  /** One full ranking pass over a view that does not change while it runs. */
  RankingSnapshot compute(RecordAccessor view) {
    long started = System.nanoTime();
    long revision = view.revision();

    Map<String, Integer> inboundLinks = inboundLinkCounter.count(view);

    Map<String, Signals> signals = new LinkedHashMap<>();
    List<Signals> languages = new ArrayList<>();
    for (String entityId : view.listEntities()) {
      Signals entitySignals =
          signalExtractor.extract(view, entityId, inboundLinks.getOrDefault(entityId, 0));
      signals.put(entityId, entitySignals);
      if (view.isInScope(entityId, RankScope.LANGUAGE.scopeName())) {
        languages.add(entitySignals);
      }
    }

    RankIndex global =
        RankIndex.of(RankScope.GLOBAL, CompositeRanker.order(new ArrayList<>(signals.values())));
    RankIndex language = RankIndex.of(RankScope.LANGUAGE, CompositeRanker.order(languages));

    log.info(
        "Ranked {} entities ({} languages) at revision {} in {} ms",
        global.size(),
        language.size(),
        revision,
        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
    return new RankingSnapshot(revision, signals, global, language);
  }

  private RankIndex navigationIndex(String entityId) {
    RankingSnapshot current = snapshot();
    requireEntity(current, entityId);
    return current.language().contains(entityId) ? current.language() : current.global();
  }

  private static void requireEntity(RankingSnapshot current, String entityId) {
    if (!current.contains(entityId)) {
      throw new UnknownEntityException(entityId);
    }
  }
}
