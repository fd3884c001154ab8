package com.example.gamesession.service;

import com.example.gamesession.config.GameSessionProperties;
import com.example.gamesession.engine.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** 終了後の保持期間を過ぎたマッチをレジストリから定期的に取り除く。 */
@Component
@ConditionalOnProperty(name = "game.sweep-enabled", havingValue = "true", matchIfMissing = true)
public class MatchSweepWorker {

  private static final Logger logger = LoggerFactory.getLogger(MatchSweepWorker.class);

  private final SessionRegistry sessionRegistry;
  private final GameSessionProperties properties;
  private final GameSessionMetrics metrics;

  public MatchSweepWorker(
      SessionRegistry sessionRegistry,
      GameSessionProperties properties,
      GameSessionMetrics metrics) {
    this.sessionRegistry = sessionRegistry;
    this.properties = properties;
    this.metrics = metrics;
  }

  @Scheduled(fixedDelayString = "${game.sweep-interval:10s}")
  public void run() {
    try {
      final int removed = sessionRegistry.sweep(properties.finishedRetention());
      if (removed > 0) {
        logger.info(
            "finished matches swept removed={} retention={}",
            removed,
            properties.finishedRetention());
      }
    } catch (RuntimeException ex) {
      logger.warn("match sweep failed", ex);
      metrics.recordDependencyError("sweep");
    }
  }
}
