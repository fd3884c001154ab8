/*
 * どこで: Game Session エンジン
 * 何を: イベント通知を単一スレッドの executor へ順序通りに積む
 * なぜ: ロック内で順序を確定し、送信 I/O はロック外で行うため
 */
package com.example.gamesession.engine;

import com.example.gamesession.model.MatchView;
import com.example.gamesession.model.Move;
import com.example.gamesession.model.RoundResult;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class QueuedGameEventListener implements GameEventListener {

  private static final Logger logger = LoggerFactory.getLogger(QueuedGameEventListener.class);

  private final GameEventListener delegate;
  private final Executor executor;

  public QueuedGameEventListener(GameEventListener delegate, Executor executor) {
    this.delegate = delegate;
    this.executor = executor;
  }

  @Override
  public void onPlayerJoined(MatchView match, String playerId) {
    submit("player_joined", () -> delegate.onPlayerJoined(match, playerId));
  }

  @Override
  public void onMatchStarted(MatchView match) {
    submit("match_started", () -> delegate.onMatchStarted(match));
  }

  @Override
  public void onRoundTick(MatchView match, int countdown) {
    submit("round_tick", () -> delegate.onRoundTick(match, countdown));
  }

  @Override
  public void onMoveSubmitted(MatchView match, String playerId, Move move, boolean autoAssigned) {
    submit("move_submitted", () -> delegate.onMoveSubmitted(match, playerId, move, autoAssigned));
  }

  @Override
  public void onRoundCompleted(MatchView match, RoundResult result) {
    submit("round_completed", () -> delegate.onRoundCompleted(match, result));
  }

  @Override
  public void onNextRound(MatchView match) {
    submit("next_round", () -> delegate.onNextRound(match));
  }

  @Override
  public void onMatchFinished(MatchView match) {
    submit("match_finished", () -> delegate.onMatchFinished(match));
  }

  @Override
  public void onPlayerLeft(MatchView match, String playerId) {
    submit("player_left", () -> delegate.onPlayerLeft(match, playerId));
  }

  @Override
  public void onPlayerDisconnected(MatchView match, String playerId) {
    submit("player_disconnected", () -> delegate.onPlayerDisconnected(match, playerId));
  }

  private void submit(String eventType, Runnable delivery) {
    try {
      executor.execute(
          () -> {
            try {
              delivery.run();
            } catch (RuntimeException ex) {
              logger.warn("event delivery failed type={}", eventType, ex);
            }
          });
    } catch (RejectedExecutionException ex) {
      // シャットダウン中は送信先も閉じているため破棄する
      logger.debug("event dropped during shutdown type={}", eventType);
    }
  }
}
