/*
 * どこで: Game Session の組み立て
 * 何を: エンジン部品（タイマー、猶予判定、キュー、ポリシー、レジストリ）と専用 executor を Bean として組み立てる
 * なぜ: レジストリの依存を明示的に注入し、テストでは同じ部品を手で組み立てられるようにするため
 */
package com.example.gamesession.config;

import com.example.gamesession.engine.AutoMoveAssigner;
import com.example.gamesession.engine.BalanceCurrencyFallbackPolicy;
import com.example.gamesession.engine.BalanceGuard;
import com.example.gamesession.engine.CurrencyFallbackPolicy;
import com.example.gamesession.engine.DisconnectGraceHandler;
import com.example.gamesession.engine.GameEventListener;
import com.example.gamesession.engine.MatchmakingQueue;
import com.example.gamesession.engine.QueuedGameEventListener;
import com.example.gamesession.engine.RoundTimer;
import com.example.gamesession.engine.SessionRegistry;
import com.example.gamesession.engine.StakePolicy;
import com.example.gamesession.profile.ProfileStore;
import com.example.gamesession.service.GameSessionMetrics;
import com.example.gamesession.settlement.SettlementDispatcher;
import com.example.gamesession.settlement.SettlementNotifier;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.random.RandomGenerator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class GameEngineConfig {

  /** マッチ作成時刻/ラウンド履歴/清算イベント時刻の時刻源。テストでは Clock.fixed を渡す。 */
  @Bean
  public Clock gameClock() {
    return Clock.systemUTC();
  }

  @Bean(destroyMethod = "shutdownNow")
  public ScheduledExecutorService gameTimerScheduler() {
    return Executors.newSingleThreadScheduledExecutor(daemonThreads("game-timer"));
  }

  @Bean(destroyMethod = "shutdown")
  public ExecutorService gameEventExecutor() {
    // 送信順序を状態変化の順序に揃えるため単一スレッド
    return Executors.newSingleThreadExecutor(daemonThreads("game-events"));
  }

  @Bean(destroyMethod = "shutdown")
  public ExecutorService collaboratorExecutor(GameSessionProperties properties) {
    return Executors.newFixedThreadPool(
        properties.collaboratorThreads(), daemonThreads("game-collaborator"));
  }

  /** @Scheduled（掃除ワーカー）用。ラウンドタイマーの executor と分ける。 */
  @Bean
  public ThreadPoolTaskScheduler taskScheduler() {
    final ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("game-sweep-");
    scheduler.setDaemon(true);
    return scheduler;
  }

  @Bean
  public RoundTimer roundTimer(
      @Qualifier("gameTimerScheduler") ScheduledExecutorService gameTimerScheduler,
      GameSessionProperties properties) {
    return new RoundTimer(
        gameTimerScheduler, properties.tickInterval(), properties.roundCountdownTicks());
  }

  @Bean
  public DisconnectGraceHandler disconnectGraceHandler(
      @Qualifier("gameTimerScheduler") ScheduledExecutorService gameTimerScheduler,
      GameSessionProperties properties) {
    return new DisconnectGraceHandler(gameTimerScheduler, properties.disconnectGrace());
  }

  @Bean
  public AutoMoveAssigner autoMoveAssigner() {
    return new AutoMoveAssigner(RandomGenerator.getDefault());
  }

  @Bean
  public StakePolicy stakePolicy(GameSessionProperties properties) {
    return new StakePolicy(properties.pointsStake());
  }

  @Bean
  public BalanceGuard balanceGuard(ProfileStore profileStore, GameSessionMetrics metrics) {
    return new BalanceGuard(profileStore, metrics);
  }

  @Bean
  public CurrencyFallbackPolicy currencyFallbackPolicy(
      BalanceGuard balanceGuard, GameSessionProperties properties) {
    return new BalanceCurrencyFallbackPolicy(
        balanceGuard,
        properties.pointsStake(),
        properties.fallbackSolStake(),
        properties.currencyFallbackEnabled());
  }

  @Bean
  public SettlementDispatcher settlementDispatcher(
      SettlementNotifier settlementNotifier,
      ProfileStore profileStore,
      @Qualifier("collaboratorExecutor") ExecutorService collaboratorExecutor,
      GameSessionMetrics metrics) {
    return new SettlementDispatcher(
        settlementNotifier, profileStore, collaboratorExecutor, metrics);
  }

  @Bean
  public SessionRegistry sessionRegistry(
      StakePolicy stakePolicy,
      BalanceGuard balanceGuard,
      CurrencyFallbackPolicy currencyFallbackPolicy,
      RoundTimer roundTimer,
      DisconnectGraceHandler disconnectGraceHandler,
      AutoMoveAssigner autoMoveAssigner,
      SettlementDispatcher settlementDispatcher,
      GameEventListener webSocketGameEventListener,
      @Qualifier("gameEventExecutor") ExecutorService gameEventExecutor,
      GameSessionMetrics metrics,
      Clock clock) {
    return new SessionRegistry(
        stakePolicy,
        balanceGuard,
        currencyFallbackPolicy,
        new MatchmakingQueue(),
        roundTimer,
        disconnectGraceHandler,
        autoMoveAssigner,
        settlementDispatcher,
        new QueuedGameEventListener(webSocketGameEventListener, gameEventExecutor),
        metrics,
        clock);
  }

  private static ThreadFactory daemonThreads(String prefix) {
    final AtomicInteger sequence = new AtomicInteger();
    return runnable -> {
      final Thread thread = new Thread(runnable, prefix + "-" + sequence.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
