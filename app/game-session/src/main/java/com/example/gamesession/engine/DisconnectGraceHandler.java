/*
 * どこで: Game Session エンジン
 * 何を: 切断したプレイヤーの没収判定を猶予時間後に 1 回だけ実行する
 * なぜ: 一時的な切断で即敗北にしないため
 */
package com.example.gamesession.engine;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DisconnectGraceHandler {

  private static final Logger logger = LoggerFactory.getLogger(DisconnectGraceHandler.class);

  private final ScheduledExecutorService scheduler;
  private final Duration graceWindow;
  private final ConcurrentMap<String, PendingCheck> pending = new ConcurrentHashMap<>();

  public DisconnectGraceHandler(ScheduledExecutorService scheduler, Duration graceWindow) {
    this.scheduler = scheduler;
    this.graceWindow = graceWindow;
  }

  /**
   * 役割: playerId の没収判定を予約する。
   * 動作: 既存の予約は取り消して置き換える。実行時点で予約が残っている場合だけ check を呼ぶ。
   */
  public void schedule(String playerId, Runnable check) {
    final PendingCheck pendingCheck = new PendingCheck(check);
    final PendingCheck previous = pending.put(playerId, pendingCheck);
    if (previous != null) {
      previous.cancel();
    }
    pendingCheck.future =
        scheduler.schedule(
            () -> run(playerId, pendingCheck), graceWindow.toMillis(), TimeUnit.MILLISECONDS);
  }

  public boolean cancel(String playerId) {
    final PendingCheck pendingCheck = pending.remove(playerId);
    if (pendingCheck == null) {
      return false;
    }
    pendingCheck.cancel();
    return true;
  }

  public boolean isPending(String playerId) {
    return pending.containsKey(playerId);
  }

  private void run(String playerId, PendingCheck pendingCheck) {
    if (!pending.remove(playerId, pendingCheck)) {
      return;
    }
    try {
      pendingCheck.check.run();
    } catch (RuntimeException ex) {
      logger.error("disconnect check failed playerId={}", playerId, ex);
    }
  }

  private static final class PendingCheck {

    private final Runnable check;
    private volatile ScheduledFuture<?> future;

    private PendingCheck(Runnable check) {
      this.check = check;
    }

    private void cancel() {
      final ScheduledFuture<?> scheduled = future;
      if (scheduled != null) {
        scheduled.cancel(false);
      }
    }
  }
}
