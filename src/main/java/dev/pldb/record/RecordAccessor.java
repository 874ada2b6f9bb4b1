package dev.pldb.record;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only capability interface the ranking engine consumes from a record back end.
 *
 * <p>Implementations expose each entity as an opaque id plus a sparse tree of named fields. Field
 * paths are space-separated segments, e.g. {@code "githubRepo stars"}. The ranking engine never
 * mutates records through this interface.
 */
public interface RecordAccessor {

    /** Scope name for entities classified as languages. */
    String LANGUAGE_SCOPE = "language";

    /**
     * Lists every entity id in enumeration order. The order is stable for an unchanged record set
     * and is used as the tie-break of every ordering built on top of it.
     *
     * @return entity ids in enumeration order
     */
    List<String> listEntities();

    /** Returns whether the entity exists in the record set. */
    boolean contains(String entityId);

    /**
     * Answers whether an entity belongs to a named scope (at least {@value #LANGUAGE_SCOPE}).
     *
     * @param entityId the entity to classify
     * @param scopeName the scope name
     * @return true if the entity is a member of the scope
     */
    boolean isInScope(String entityId, String scopeName);

    /**
     * Reads a scalar field.
     *
     * @param entityId the entity to read
     * @param path space-separated field path
     * @return the field's text, or empty if the field is absent
     */
    Optional<String> getField(String entityId, String path);

    /**
     * Reads a time-series field as a mapping of (usually year) keys to raw values.
     *
     * @param entityId the entity to read
     * @param path space-separated field path
     * @return the series, empty if the field is absent
     */
    Map<String, String> getTimeSeries(String entityId, String path);

    /** Number of serialisable facts recorded for the entity. */
    int getFactCount(String entityId);

    /** Ids of the entities this entity's record declares a cross-reference to. */
    List<String> getOutboundReferences(String entityId);

    /**
     * Monotonic revision of the record set. Back ends that allow mutation bump it on every change
     * so caches built on top of the record set can detect staleness.
     *
     * @return the current revision, {@code 0} for static back ends
     */
    default long revision() {
        return 0L;
    }

    /**
     * Returns a view of the record set that concurrent mutation cannot change, for reads that must
     * agree with each other such as one ranking pass. The view's {@link #revision()} is the revision
     * of the contents it holds.
     *
     * @return this accessor for back ends that never change, otherwise a point-in-time copy
     */
    default RecordAccessor consistentView() {
        return this;
    }
}
