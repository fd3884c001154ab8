/*
 * どこで: Game Session の清算連携
 * 何を: 決着時の清算通知/履歴記録と、待機中退出の返金を非同期に依頼する
 * なぜ: 外部呼び出しをレジストリのロック外で実行し、失敗してもマッチ進行を止めないため
 */
package com.example.gamesession.settlement;

import com.example.gamesession.model.MatchSummary;
import com.example.gamesession.model.MatchView;
import com.example.gamesession.profile.ProfileStore;
import com.example.gamesession.service.GameSessionMetrics;
import java.math.BigDecimal;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SettlementDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(SettlementDispatcher.class);

  private final SettlementNotifier notifier;
  private final ProfileStore profileStore;
  private final Executor executor;
  private final GameSessionMetrics metrics;

  public SettlementDispatcher(
      SettlementNotifier notifier,
      ProfileStore profileStore,
      Executor executor,
      GameSessionMetrics metrics) {
    this.notifier = notifier;
    this.profileStore = profileStore;
    this.executor = executor;
    this.metrics = metrics;
  }

  /**
   * 役割: 勝者が決まったマッチの履歴記録と清算通知を依頼する。
   * 動作: collaborator executor 上で履歴記録、清算通知の順に実行する。失敗はログとメトリクスに残し再試行しない。
   * 前提: 呼び出し側で清算済みフラグを立て済みであること。
   */
  public void settle(MatchView match, String winnerAccount, String loserAccount) {
    final MatchSummary summary = toSummary(match, winnerAccount);
    submit(
        "settle",
        match.matchId(),
        () -> {
          recordHistory(summary);
          notifySettled(match, winnerAccount, loserAccount);
        });
  }

  public void refund(String matchId, String account, BigDecimal stake) {
    if (account == null || account.isBlank()) {
      logger.debug("refund skipped without account matchId={}", matchId);
      return;
    }
    submit(
        "refund",
        matchId,
        () -> {
          try {
            profileStore.refund(account, stake, matchId);
            logger.info("stake refunded matchId={} account={} amount={}", matchId, account, stake);
          } catch (RuntimeException ex) {
            metrics.recordDependencyError("refund");
            logger.warn("refund failed matchId={} account={}", matchId, account, ex);
          }
        });
  }

  private void recordHistory(MatchSummary summary) {
    try {
      profileStore.recordHistory(summary);
    } catch (RuntimeException ex) {
      metrics.recordDependencyError("record_history");
      logger.warn("match history recording failed matchId={}", summary.matchId(), ex);
    }
  }

  private void notifySettled(MatchView match, String winnerAccount, String loserAccount) {
    if (winnerAccount == null || loserAccount == null) {
      metrics.recordSettlement("skipped");
      logger.warn(
          "settlement skipped without both accounts matchId={} winnerAccount={} loserAccount={}",
          match.matchId(),
          winnerAccount,
          loserAccount);
      return;
    }
    try {
      final boolean accepted =
          notifier.notifyMatchSettled(match.matchId(), winnerAccount, loserAccount, match.stake());
      if (accepted) {
        metrics.recordSettlement("success");
        logger.info(
            "settlement notified matchId={} winnerAccount={} loserAccount={} stake={}",
            match.matchId(),
            winnerAccount,
            loserAccount,
            match.stake());
        return;
      }
      metrics.recordSettlement("rejected");
      logger.error("SETTLEMENT_NOTIFY_FAILED matchId={} notifier rejected", match.matchId());
    } catch (RuntimeException ex) {
      metrics.recordSettlement("error");
      logger.error("SETTLEMENT_NOTIFY_FAILED matchId={}", match.matchId(), ex);
    }
  }

  private void submit(String operation, String matchId, Runnable task) {
    try {
      executor.execute(task);
    } catch (RejectedExecutionException ex) {
      metrics.recordDependencyError(operation + "_rejected");
      logger.error("collaborator task rejected operation={} matchId={}", operation, matchId, ex);
    }
  }

  private static MatchSummary toSummary(MatchView match, String winnerAccount) {
    return new MatchSummary(
        match.matchId(),
        match.currency(),
        match.stake(),
        match.totalPot(),
        match.platformFee(),
        match.winnerPayout(),
        match.player1().account(),
        match.player2().account(),
        winnerAccount,
        match.finishReason(),
        match.history().size(),
        match.createdAt(),
        match.finishedAt());
  }
}
