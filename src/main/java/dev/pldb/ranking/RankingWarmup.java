package dev.pldb.ranking;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Computes the rankings once the application has started, so a broken cross-reference fails the
 * startup rather than the first query, and logs the head of each ordering.
 */
@Component
public class RankingWarmup implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(RankingWarmup.class);

  private final RankingService rankingService;
  private final RankingProperties properties;

  public RankingWarmup(RankingService rankingService, RankingProperties properties) {
    this.rankingService = rankingService;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    if (!properties.isWarmOnStartup()) {
      log.debug("Ranking warm-up disabled; rankings are computed on first query");
      return;
    }
    RankingSnapshot snapshot = rankingService.snapshot();
    int limit = properties.getLogTop();
    if (limit == 0) {
      return;
    }
    for (RankScope scope : RankScope.values()) {
      RankIndex index = snapshot.index(scope);
      for (RankedEntity entity : index.ordering().subList(0, Math.min(limit, index.size()))) {
        log.info(
            "{} #{} {} ({})",
            index.scope().scopeName(),
            entity.index() + 1,
            entity.entityId(),
            entity.explanation().toDebugString());
      }
    }
  }
}
