/*
 * どこで: Game Session エンジン
 * 何を: マッチごとのラウンドカウントダウンを管理する
 * なぜ: 1 マッチにつき生存ハンドルを 1 つに保ち、再武装時に古いタイマーを確実に止めるため
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

/**
 * マッチ ID をキーとしたカウントダウンのアリーナ。
 *
 * <p>各ティックは次のティックを自分で予約する。cancel 後に走ったティックは何もしない。コールバック側は
 * {@link #isArmed(String, int)} で自分が最新のハンドルかどうかを確認する。
 */
public class RoundTimer {

  private static final Logger logger = LoggerFactory.getLogger(RoundTimer.class);

  /** カウントダウンの通知先。 */
  public interface Listener {

    void onTick(String matchId, int round, int remaining);

    void onExpired(String matchId, int round);
  }

  private final ScheduledExecutorService scheduler;
  private final Duration tickInterval;
  private final int countdownTicks;
  private final ConcurrentMap<String, Countdown> countdowns = new ConcurrentHashMap<>();

  public RoundTimer(ScheduledExecutorService scheduler, Duration tickInterval, int countdownTicks) {
    if (countdownTicks <= 0) {
      throw new IllegalArgumentException("countdownTicks must be positive");
    }
    this.scheduler = scheduler;
    this.tickInterval = tickInterval;
    this.countdownTicks = countdownTicks;
  }

  public int countdownTicks() {
    return countdownTicks;
  }

  /** 既存ハンドルを取り消してから新しいカウントダウンを開始する。 */
  public void arm(String matchId, int round, Listener listener) {
    final Countdown countdown = new Countdown(matchId, round, listener);
    final Countdown previous = countdowns.put(matchId, countdown);
    if (previous != null) {
      previous.cancel();
    }
    countdown.scheduleNext();
  }

  public void cancel(String matchId) {
    final Countdown countdown = countdowns.remove(matchId);
    if (countdown != null) {
      countdown.cancel();
    }
  }

  public boolean isArmed(String matchId, int round) {
    final Countdown countdown = countdowns.get(matchId);
    return countdown != null && countdown.round == round && !countdown.cancelled;
  }

  public int liveTimers() {
    return countdowns.size();
  }

  private final class Countdown {

    private final String matchId;
    private final int round;
    private final Listener listener;
    private int remaining = countdownTicks;
    private volatile boolean cancelled;
    private volatile ScheduledFuture<?> next;

    private Countdown(String matchId, int round, Listener listener) {
      this.matchId = matchId;
      this.round = round;
      this.listener = listener;
    }

    private void scheduleNext() {
      if (cancelled) {
        return;
      }
      next = scheduler.schedule(this::tick, tickInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void tick() {
      if (cancelled) {
        return;
      }
      remaining--;
      try {
        listener.onTick(matchId, round, remaining);
        if (remaining <= 0) {
          listener.onExpired(matchId, round);
          // 満了後に再武装されていなければアリーナから外す
          countdowns.remove(matchId, this);
          return;
        }
      } catch (RuntimeException ex) {
        logger.error("round timer callback failed matchId={} round={}", matchId, round, ex);
        if (remaining <= 0) {
          countdowns.remove(matchId, this);
          return;
        }
      }
      scheduleNext();
    }

    private void cancel() {
      cancelled = true;
      final ScheduledFuture<?> future = next;
      if (future != null) {
        future.cancel(false);
      }
    }
  }
}
