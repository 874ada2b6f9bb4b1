package dev.pldb.signal;

import dev.pldb.record.RecordAccessor;
import java.util.Map;
import java.util.Optional;

/**
 * Turns an entity's sparse optional fields into ranking signals using a {@link SignalWeights}
 * table.
 *
 * <p>Absent fields contribute nothing; none of the estimates fail on missing data. Estimates are
 * clamped at zero so a mistyped negative field cannot produce a negative signal.
 */
public class SignalExtractor {

  private final SignalWeights weights;

  public SignalExtractor(SignalWeights weights) {
    this.weights = weights;
  }

  /**
   * Estimated number of users: latest values of the most-recent series, plus the direct fields,
   * plus every present custom field's transform, rounded half-up.
   */
  public long estimateUsers(RecordAccessor records, String entityId) {
    double total = 0.0;
    for (String field : weights.mostRecentFields()) {
      total += latest(records, entityId, field);
    }
    for (String field : weights.directFields()) {
      total += records.getField(entityId, field).map(NumericText::leadingLong).orElse(0L);
    }
    for (Map.Entry<String, FieldTransform> custom : weights.customFields().entrySet()) {
      Optional<String> value = records.getField(entityId, custom.getKey());
      if (value.isPresent() && !value.get().isBlank()) {
        total += custom.getValue().apply(value.get());
      }
    }
    return Math.max(0L, Math.round(total));
  }

  /** Estimated job openings: a fraction of the skill count plus the job-board count. */
  public long estimateJobs(RecordAccessor records, String entityId) {
    long fromSkill =
        Math.round(latest(records, entityId, weights.skillField()) * weights.skillJobsFactor());
    return Math.max(0L, fromSkill + latest(records, entityId, weights.jobBoardField()));
  }

  public int factCount(RecordAccessor records, String entityId) {
    return Math.max(0, records.getFactCount(entityId));
  }

  /**
   * Extracts all four signals of one entity.
   *
   * @param records the record set
   * @param entityId the entity
   * @param inboundLinks the entity's inbound reference count from {@link InboundLinkCounter}
   * @return the entity's signals
   */
  public Signals extract(RecordAccessor records, String entityId, int inboundLinks) {
    return new Signals(
        entityId,
        estimateJobs(records, entityId),
        estimateUsers(records, entityId),
        factCount(records, entityId),
        inboundLinks);
  }

  private static long latest(RecordAccessor records, String entityId, String field) {
    return TimeSeries.latestValue(records.getTimeSeries(entityId, field));
  }
}
