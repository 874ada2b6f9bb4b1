package dev.pldb.record;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory {@link RecordAccessor} over a set of {@link EntityRecord}s.
 *
 * <p>Enumeration order is insertion order; replacing an existing record keeps its position. Every
 * mutation bumps {@link #revision()}, which is what tells the ranking cache that its snapshot is
 * stale. Reads and writes are synchronized on the store so a reader never observes a half-applied
 * {@link #replaceAll(Collection)}.
 */
public class RecordStore implements RecordAccessor {

    private final Map<String, EntityRecord> records = new LinkedHashMap<>();
    private final AtomicLong revision = new AtomicLong();

    public RecordStore() {
    }

    public RecordStore(Collection<EntityRecord> initial) {
        initial.forEach(record -> records.put(record.id(), record));
    }

    private RecordStore(Collection<EntityRecord> initial, long revision) {
        this(initial);
        this.revision.set(revision);
    }

    /**
     * Adds or replaces a record.
     *
     * @param record the record to store
     */
    public synchronized void put(EntityRecord record) {
        records.put(record.id(), record);
        revision.incrementAndGet();
    }

    /**
     * Removes a record.
     *
     * @param entityId the entity to remove
     * @return true if a record was removed
     */
    public synchronized boolean remove(String entityId) {
        boolean removed = records.remove(entityId) != null;
        if (removed) {
            revision.incrementAndGet();
        }
        return removed;
    }

    /**
     * Replaces the whole record set, e.g. after re-reading the records directory.
     *
     * @param replacement the new records, in enumeration order
     */
    public synchronized void replaceAll(Collection<EntityRecord> replacement) {
        records.clear();
        replacement.forEach(record -> records.put(record.id(), record));
        revision.incrementAndGet();
    }

    public synchronized int size() {
        return records.size();
    }

    @Override
    public synchronized List<String> listEntities() {
        return List.copyOf(records.keySet());
    }

    @Override
    public synchronized boolean contains(String entityId) {
        return records.containsKey(entityId);
    }

    @Override
    public boolean isInScope(String entityId, String scopeName) {
        EntityRecord record = require(entityId);
        if (LANGUAGE_SCOPE.equals(scopeName)) {
            return EntityType.isLanguage(record.type());
        }
        throw new IllegalArgumentException("Unknown scope: " + scopeName);
    }

    @Override
    public Optional<String> getField(String entityId, String path) {
        return require(entityId).text(path);
    }

    @Override
    public Map<String, String> getTimeSeries(String entityId, String path) {
        return require(entityId).series(path);
    }

    @Override
    public int getFactCount(String entityId) {
        return require(entityId).factCount();
    }

    @Override
    public List<String> getOutboundReferences(String entityId) {
        return new ArrayList<>(require(entityId).references());
    }

    @Override
    public long revision() {
        return revision.get();
    }

    /**
     * Copies the current records under the store's lock. Records are immutable, so the copy shares
     * them; later mutations of this store do not reach it.
     */
    @Override
    public synchronized RecordAccessor consistentView() {
        return new RecordStore(records.values(), revision.get());
    }

    private synchronized EntityRecord require(String entityId) {
        EntityRecord record = records.get(entityId);
        if (record == null) {
            throw new IllegalArgumentException("No entity with id '" + entityId + "'");
        }
        return record;
    }
}
