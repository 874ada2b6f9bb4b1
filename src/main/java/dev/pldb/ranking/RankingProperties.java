package dev.pldb.ranking;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for loading and ranking the record set.
 *
 * <p>Properties are bound from {@code pldb.ranking.*} in application.yml / application.properties.
 *
 * <ul>
 *   <li>{@code records-dir} - directory of {@code *.json} entity records (default {@code records})
 *   <li>{@code warm-on-startup} - compute the rankings when the application starts instead of on
 *       first query (default true)
 *   <li>{@code log-top} - number of top entities per scope logged after warm-up (default 10,
 *       bounded [0, 100])
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "pldb.ranking")
public class RankingProperties {

  private String recordsDir = "records";
  private boolean warmOnStartup = true;
  private int logTop = 10;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (recordsDir == null || recordsDir.isBlank()) {
      throw new IllegalStateException("pldb.ranking.records-dir must not be blank");
    }
    if (logTop < 0 || logTop > 100) {
      throw new IllegalStateException("pldb.ranking.log-top must be in [0, 100], got: " + logTop);
    }
  }

  public String getRecordsDir() {
    return recordsDir;
  }

  public void setRecordsDir(String recordsDir) {
    this.recordsDir = recordsDir;
  }

  public boolean isWarmOnStartup() {
    return warmOnStartup;
  }

  public void setWarmOnStartup(boolean warmOnStartup) {
    this.warmOnStartup = warmOnStartup;
  }

  public int getLogTop() {
    return logTop;
  }

  public void setLogTop(int logTop) {
    this.logTop = logTop;
  }
}
