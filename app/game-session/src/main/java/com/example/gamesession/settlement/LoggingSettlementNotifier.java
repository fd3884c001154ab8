package com.example.gamesession.settlement;

import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/** NATS 無効時の清算通知。ログに残すだけで常に受理扱い。 */
@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class LoggingSettlementNotifier implements SettlementNotifier {

  private static final Logger logger = LoggerFactory.getLogger(LoggingSettlementNotifier.class);

  @Override
  public boolean notifyMatchSettled(
      String matchId, String winnerAccount, String loserAccount, BigDecimal stake) {
    logger.info(
        "settlement (nats disabled) matchId={} winnerAccount={} loserAccount={} stake={}",
        matchId,
        winnerAccount,
        loserAccount,
        stake);
    return true;
  }
}
