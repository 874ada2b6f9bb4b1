package dev.pldb.signal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative heuristic table behind the user and job estimates.
 *
 * <p>The estimates are crude linear models. The constants in {@link #defaults()} are kept exactly
 * as the record set has always been ranked with; change them only together with a re-ranking.
 *
 * <ul>
 *   <li>{@code mostRecentFields} - time series whose latest value counts as users
 *   <li>{@code directFields} - plain numeric fields counted as users as-is
 *   <li>{@code customFields} - fields with their own transform, applied when the field is present
 *   <li>{@code skillField} / {@code skillJobsFactor} - professional-network skill count, a fraction
 *       of which estimates job openings
 *   <li>{@code jobBoardField} - job-board posting count time series, added to the job estimate
 * </ul>
 *
 * @param mostRecentFields time-series field paths summed by latest value
 * @param directFields numeric field paths summed as-is
 * @param customFields field path to transform, in evaluation order
 * @param skillField time-series path of the skill count
 * @param skillJobsFactor fraction of the skill count that becomes job openings
 * @param jobBoardField time-series path of the job-board posting count
 */
public record SignalWeights(
    List<String> mostRecentFields,
    List<String> directFields,
    Map<String, FieldTransform> customFields,
    String skillField,
    double skillJobsFactor,
    String jobBoardField) {

  public SignalWeights {
    mostRecentFields = List.copyOf(mostRecentFields);
    directFields = List.copyOf(directFields);
    customFields = Collections.unmodifiableMap(new LinkedHashMap<>(customFields));
    if (skillJobsFactor < 0.0) {
      throw new IllegalArgumentException("skillJobsFactor must be >= 0, got: " + skillJobsFactor);
    }
  }

  /** The standard table. */
  public static SignalWeights defaults() {
    Map<String, FieldTransform> customs = new LinkedHashMap<>();
    customs.put("wikipedia", FieldTransform.constant(20));
    customs.put("packageRepository", FieldTransform.constant(1000));
    // 95% of page views are bots and 1% of users visit the page daily: 100 * (views / 20)
    customs.put("wikipedia dailyPageViews", FieldTransform.linearWhole(5));
    // GitHub Linguist requires a minimum of 200 users before accepting a grammar
    customs.put("linguistGrammarRepo", FieldTransform.constant(200));
    customs.put("codeMirror", FieldTransform.constant(50));
    customs.put("website", FieldTransform.constant(1));
    customs.put("githubRepo", FieldTransform.constant(1));
    customs.put("githubRepo forks", FieldTransform.linear(3));
    customs.put("annualReport", FieldTransform.constant(1000));

    return new SignalWeights(
        List.of("linkedInSkill", "subreddit memberCount", "projectEuler members"),
        List.of("meetup members", "githubRepo stars"),
        customs,
        "linkedInSkill",
        0.01,
        "indeedJobs");
  }
}
