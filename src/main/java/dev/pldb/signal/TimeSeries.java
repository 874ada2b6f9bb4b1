package dev.pldb.signal;

import java.util.Map;
import java.util.OptionalLong;
import org.jspecify.annotations.Nullable;

/** Helpers for year-keyed series such as {@code {"2019": 5, "2021": 12}}. */
public final class TimeSeries {

  private TimeSeries() {}

  /**
   * Returns the value stored under the numerically largest key.
   *
   * <p>Keys that are not integers, or do not fit a {@code long}, are ignored. An absent or empty series, or one where every key is
   * ignored, yields 0.
   *
   * @param series key to raw value mapping
   * @return the latest value, or 0
   */
  public static long latestValue(@Nullable Map<String, String> series) {
    if (series == null || series.isEmpty()) {
      return 0L;
    }
    boolean found = false;
    long latestKey = 0L;
    @Nullable String latestValue = null;
    for (Map.Entry<String, String> entry : series.entrySet()) {
      OptionalLong parsed = NumericText.strictLong(entry.getKey());
      if (parsed.isEmpty()) {
        continue;
      }
      long key = parsed.getAsLong();
      if (!found || key > latestKey) {
        found = true;
        latestKey = key;
        latestValue = entry.getValue();
      }
    }
    return !found ? 0L : NumericText.leadingLong(latestValue);
  }
}
