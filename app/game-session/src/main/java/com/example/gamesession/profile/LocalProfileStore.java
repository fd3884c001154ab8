/*
 * どこで: Game Session の外部連携（ローカル代替）
 * 何を: プロフィールサービス無しで起動するための ProfileStore 実装
 * なぜ: ローカル開発やテストで残高確認を常に成功させるため
 */
package com.example.gamesession.profile;

import com.example.gamesession.model.MatchSummary;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "profile.remote-enabled", havingValue = "false", matchIfMissing = true)
public class LocalProfileStore implements ProfileStore {

  private static final Logger logger = LoggerFactory.getLogger(LocalProfileStore.class);

  @Override
  public boolean hasSufficientBalance(String account, BigDecimal amount) {
    return true;
  }

  @Override
  public void refund(String account, BigDecimal amount, String matchId) {
    logger.info("local refund account={} amount={} matchId={}", account, amount, matchId);
  }

  @Override
  public void recordHistory(MatchSummary summary) {
    logger.info(
        "local match history matchId={} winnerAccount={} reason={}",
        summary.matchId(),
        summary.winnerAccount(),
        summary.finishReason());
  }
}
