package com.example.gamesession.engine;

import com.example.gamesession.profile.ProfileStore;
import com.example.gamesession.service.GameSessionMetrics;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** ProfileStore の残高確認を包み、障害時は残高不足として扱う。 */
public class BalanceGuard {

  private static final Logger logger = LoggerFactory.getLogger(BalanceGuard.class);

  private final ProfileStore profileStore;
  private final GameSessionMetrics metrics;

  public BalanceGuard(ProfileStore profileStore, GameSessionMetrics metrics) {
    this.profileStore = profileStore;
    this.metrics = metrics;
  }

  public boolean hasSufficientBalance(String account, BigDecimal amount) {
    try {
      return profileStore.hasSufficientBalance(account, amount);
    } catch (RuntimeException ex) {
      metrics.recordDependencyError("balance_check");
      logger.warn("balance check failed account={} amount={}", account, amount, ex);
      return false;
    }
  }

  public void requireBalance(String account, BigDecimal amount) {
    if (!hasSufficientBalance(account, amount)) {
      throw new GameSessionException(
          GameErrorCode.INSUFFICIENT_BALANCE, "insufficient balance for stake " + amount);
    }
  }
}
