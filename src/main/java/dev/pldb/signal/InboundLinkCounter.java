package dev.pldb.signal;

import dev.pldb.record.RecordAccessor;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts, for every entity, how many references other records declare to it, by inverting each
 * record's outbound references.
 */
public class InboundLinkCounter {

  /**
   * Builds the inbound reference count of every entity in the record set. Each declared reference
   * counts once, so a record referencing the same target twice contributes two.
   *
   * @param records the whole record set
   * @return entity id to inbound count, in enumeration order; entities nobody references map to 0
   * @throws DanglingReferenceException if any record references an id not in the record set
   */
  public Map<String, Integer> count(RecordAccessor records) {
    List<String> entityIds = records.listEntities();
    Map<String, Integer> inbound = new LinkedHashMap<>();
    for (String id : entityIds) {
      inbound.put(id, 0);
    }
    for (String sourceId : entityIds) {
      for (String targetId : records.getOutboundReferences(sourceId)) {
        Integer current = inbound.get(targetId);
        if (current == null) {
          throw new DanglingReferenceException(sourceId, targetId);
        }
        inbound.put(targetId, current + 1);
      }
    }
    return inbound;
  }
}
