/*
 * どこで: Game Session エンジン
 * 何を: マッチ表/プレイヤー対応表/待機キュー/タイマーを 1 つの排他区間で管理する唯一の入口
 * なぜ: 状態変化・タイマー再武装・イベント順序を同じロックで確定させ、清算の二重実行を防ぐため
 */
package com.example.gamesession.engine;

import com.example.gamesession.model.Currency;
import com.example.gamesession.model.FinishReason;
import com.example.gamesession.model.Match;
import com.example.gamesession.model.MatchKind;
import com.example.gamesession.model.MatchStatus;
import com.example.gamesession.model.MatchView;
import com.example.gamesession.model.MatchmakingTicket;
import com.example.gamesession.model.Move;
import com.example.gamesession.model.PlayerSlot;
import com.example.gamesession.model.RegistryStats;
import com.example.gamesession.model.RoundResult;
import com.example.gamesession.model.SlotPosition;
import com.example.gamesession.model.StakeRequest;
import com.example.gamesession.service.GameSessionMetrics;
import com.example.gamesession.settlement.SettlementDispatcher;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * セッションレジストリ。
 *
 * <p>すべての公開操作は内部の {@link ReentrantLock} を取得して実行される。残高確認など外部呼び出しはロック外で行い、ロック取得後に状態を再検証する。
 * イベント通知はロック保持中に {@link GameEventListener} へ順序通り渡す。
 */
public class SessionRegistry implements RoundTimer.Listener {

  private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, Match> matches = new LinkedHashMap<>();
  private final Map<String, String> playerMatches = new HashMap<>();

  private final StakePolicy stakePolicy;
  private final BalanceGuard balanceGuard;
  private final CurrencyFallbackPolicy currencyFallbackPolicy;
  private final MatchmakingQueue queue;
  private final RoundTimer roundTimer;
  private final DisconnectGraceHandler graceHandler;
  private final AutoMoveAssigner autoMoveAssigner;
  private final SettlementDispatcher settlementDispatcher;
  private final GameEventListener events;
  private final GameSessionMetrics metrics;
  private final Clock clock;

  public SessionRegistry(
      StakePolicy stakePolicy,
      BalanceGuard balanceGuard,
      CurrencyFallbackPolicy currencyFallbackPolicy,
      MatchmakingQueue queue,
      RoundTimer roundTimer,
      DisconnectGraceHandler graceHandler,
      AutoMoveAssigner autoMoveAssigner,
      SettlementDispatcher settlementDispatcher,
      GameEventListener events,
      GameSessionMetrics metrics,
      Clock clock) {
    this.stakePolicy = stakePolicy;
    this.balanceGuard = balanceGuard;
    this.currencyFallbackPolicy = currencyFallbackPolicy;
    this.queue = queue;
    this.roundTimer = roundTimer;
    this.graceHandler = graceHandler;
    this.autoMoveAssigner = autoMoveAssigner;
    this.settlementDispatcher = settlementDispatcher;
    this.events = events;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * 役割: 新しいマッチを作成し、作成者を player1 に着席させる。
   * 動作: ステーク検証、points の残高確認（ロック外）、作成者の既存対応を上書きしてから登録する。
   * 前提: requestedMatchId が稼働中マッチと衝突する場合は MATCH_IN_PROGRESS。
   */
  public MatchView createMatch(CreateMatchCommand command) {
    requirePlayerId(command.playerId());
    if (command.kind() == null) {
      throw new GameSessionException(GameErrorCode.INVALID_REQUEST, "kind is required");
    }
    stakePolicy.requireValid(command.currency(), command.stake());
    if (requiresBalanceCheck(command.currency(), command.account())) {
      balanceGuard.requireBalance(command.account(), command.stake());
    }
    return locked(
        () ->
            createLocked(
                    command.kind(),
                    command.currency(),
                    command.stake(),
                    command.playerId(),
                    command.sessionHandle(),
                    command.account(),
                    command.requestedMatchId())
                .toView());
  }

  /**
   * 役割: 既存マッチへ参加する。
   * 動作: 2 席目が埋まったら ACTIVE へ遷移し、ラウンド 1 のタイマーを武装して match_started を通知する。
   *       着席済みプレイヤーの再参加は同じ座席を取り直す。
   */
  public JoinOutcome joinMatch(JoinMatchCommand command) {
    requirePlayerId(command.playerId());
    if (command.matchId() == null || command.matchId().isBlank()) {
      throw new GameSessionException(GameErrorCode.INVALID_REQUEST, "matchId is required");
    }
    final JoinPrecheck precheck =
        locked(
            () -> {
              final Match match = requireJoinable(command.matchId(), command.playerId());
              return new JoinPrecheck(
                  match.currency(), match.stake(), match.contains(command.playerId()));
            });
    if (!precheck.alreadySeated() && requiresBalanceCheck(precheck.currency(), command.account())) {
      balanceGuard.requireBalance(command.account(), precheck.stake());
    }
    return locked(
        () -> {
          // 残高確認の間に状態が変わっている可能性があるため再検証する
          final Match match = requireJoinable(command.matchId(), command.playerId());
          return joinLocked(
              match, command.playerId(), command.sessionHandle(), command.account());
        });
  }

  /**
   * 役割: 同条件の相手を探してマッチさせる。見つからなければ待機キューへ登録する。
   * 動作: 稼働中マッチから自動退出した後、通貨フォールバックを適用し、
   *       (a) 待機中の公開マッチ (b) キュー内のチケット (c) キュー登録と待機マッチ作成 の順に試す。
   */
  public RandomMatchOutcome findOrCreateRandomMatch(RandomMatchCommand command) {
    requirePlayerId(command.playerId());
    if (command.currency() == null) {
      throw new GameSessionException(GameErrorCode.INVALID_STAKE, "currency is required");
    }
    lockedRun(() -> autoLeaveLocked(command.playerId()));
    final StakeRequest resolved =
        currencyFallbackPolicy.resolve(
            new StakeRequest(command.currency(), command.stake()), command.account());
    stakePolicy.requireValid(resolved.currency(), resolved.stake());
    return locked(() -> randomLocked(command, resolved));
  }

  /**
   * 役割: 現在ラウンドの手を記録する。
   * 動作: 対応表で所属マッチを引き、無ければ照合スキャンで探して対応表を修復する。両者の手が揃えば同期的にラウンドを解決する。
   * 前提: 返却するスナップショットはラウンド解決直後（次ラウンドへ進む前）の状態。
   */
  public MoveOutcome submitMove(String playerId, String moveValue, String matchHint) {
    requirePlayerId(playerId);
    final Move move = MoveResolver.parse(moveValue);
    return locked(
        () -> {
          final Match match = locateForMove(playerId, matchHint);
          final SlotPosition position =
              match
                  .positionOf(playerId)
                  .orElseThrow(
                      () ->
                          new GameSessionException(
                              GameErrorCode.PLAYER_NOT_IN_ANY_MATCH,
                              "player is not seated in match " + match.id()));
          MatchRules.recordMove(match, position, move);
          events.onMoveSubmitted(match.toView(), playerId, move, false);
          if (!MatchRules.bothMovesSubmitted(match)) {
            return new MoveOutcome(match.toView(), false, null);
          }
          final ResolvedRound resolved = resolveRound(match);
          return new MoveOutcome(resolved.snapshot(), true, resolved.result());
        });
  }

  /**
   * 役割: プレイヤーを所属マッチから退出させる。
   * 動作: 待機チケットを削除し座席を空ける。ACTIVE なら残った側の不戦勝、WAITING なら返金、両席が空なら勝者なしで終了する。
   *       既に FINISHED のマッチでは対応表から外すだけ。
   */
  public LeaveOutcome leaveMatch(String playerId) {
    requirePlayerId(playerId);
    return locked(() -> leaveLocked(playerId));
  }

  /** 通信切断を反映する。sessionHandle が現在の座席と異なる場合は古い接続として無視する。 */
  public void disconnect(String playerId, String sessionHandle) {
    if (playerId == null || playerId.isBlank()) {
      return;
    }
    lockedRun(
        () -> {
          final Match match = mappedMatch(playerId);
          if (match == null || !match.isLive()) {
            queue.remove(playerId);
            return;
          }
          final Optional<SlotPosition> position = match.positionOf(playerId);
          if (position.isEmpty()) {
            return;
          }
          final PlayerSlot slot = match.slot(position.get());
          if (sessionHandle != null
              && slot.sessionHandle() != null
              && !sessionHandle.equals(slot.sessionHandle())) {
            logger.debug(
                "ignoring stale disconnect playerId={} sessionHandle={}", playerId, sessionHandle);
            return;
          }
          slot.detachSession();
          if (match.status() == MatchStatus.WAITING_FOR_OPPONENT) {
            queue.remove(playerId);
            logger.info(
                "player disconnected while waiting playerId={} matchId={}", playerId, match.id());
            return;
          }
          logger.info("player disconnected playerId={} matchId={}", playerId, match.id());
          events.onPlayerDisconnected(match.toView(), playerId);
          final String matchId = match.id();
          graceHandler.schedule(playerId, () -> checkDisconnect(playerId, matchId));
        });
  }

  /** 猶予時間満了時の判定。まだ切断中なら相手の不戦勝にする。 */
  public void checkDisconnect(String playerId, String matchId) {
    lockedRun(
        () -> {
          final Match match = matches.get(matchId);
          if (match == null || match.status() != MatchStatus.ACTIVE) {
            return;
          }
          final Optional<SlotPosition> position = match.positionOf(playerId);
          if (position.isEmpty()) {
            return;
          }
          final PlayerSlot slot = match.slot(position.get());
          if (slot.isConnected()) {
            return;
          }
          final PlayerSlot opponent = match.slot(position.get().opponent());
          logger.info(
              "disconnect grace expired, forfeiting playerId={} matchId={}", playerId, matchId);
          match.finish(
              opponent.isOccupied() ? opponent.playerId() : null,
              FinishReason.FORFEIT_DISCONNECT,
              clock.instant());
          completeMatch(match, slot.account());
        });
  }

  /**
   * 役割: プレイヤーの座席へ新しい接続を関連付ける（再接続）。
   * 動作: 座席の接続を更新し、保留中の没収判定を取り消す。接続が変わった場合に true。
   */
  public boolean attachSession(String playerId, String sessionHandle) {
    if (playerId == null || playerId.isBlank() || sessionHandle == null) {
      return false;
    }
    return locked(
        () -> {
          final Match match = mappedMatch(playerId);
          if (match == null || !match.isLive()) {
            return false;
          }
          final Optional<SlotPosition> position = match.positionOf(playerId);
          if (position.isEmpty()) {
            return false;
          }
          final PlayerSlot slot = match.slot(position.get());
          if (sessionHandle.equals(slot.sessionHandle())) {
            return false;
          }
          final boolean wasDetached = !slot.isConnected();
          slot.attachSession(sessionHandle);
          final boolean cancelled = graceHandler.cancel(playerId);
          if (wasDetached || cancelled) {
            logger.info("player reconnected playerId={} matchId={}", playerId, match.id());
          }
          return true;
        });
  }

  @Override
  public void onTick(String matchId, int round, int remaining) {
    lockedRun(
        () -> {
          final Match match = currentRoundMatch(matchId, round);
          if (match == null) {
            return;
          }
          events.onRoundTick(match.toView(), remaining);
        });
  }

  @Override
  public void onExpired(String matchId, int round) {
    lockedRun(
        () -> {
          final Match match = currentRoundMatch(matchId, round);
          if (match == null) {
            return;
          }
          handleRoundTimeout(match);
        });
  }

  public Optional<MatchView> getMatch(String matchId) {
    return read(() -> Optional.ofNullable(matches.get(matchId)).map(Match::toView));
  }

  public Optional<MatchView> getPlayerMatch(String playerId) {
    return read(() -> Optional.ofNullable(mappedMatch(playerId)).map(Match::toView));
  }

  public RegistryStats stats() {
    return read(
        () -> {
          int active = 0;
          int waiting = 0;
          int finished = 0;
          for (Match match : matches.values()) {
            switch (match.status()) {
              case ACTIVE -> active++;
              case WAITING_FOR_OPPONENT -> waiting++;
              case FINISHED -> finished++;
            }
          }
          return new RegistryStats(
              matches.size(),
              active,
              waiting,
              finished,
              playerMatches.size(),
              queue.size(),
              roundTimer.liveTimers());
        });
  }

  /** 終了から maxAge 以上経過したマッチを削除し、削除件数を返す。 */
  public int sweep(Duration maxAge) {
    return locked(
        () -> {
          final Instant cutoff = clock.instant().minus(maxAge);
          final List<Match> expired = new ArrayList<>();
          for (Match match : matches.values()) {
            if (match.status() == MatchStatus.FINISHED
                && match.finishedAt() != null
                && !match.finishedAt().isAfter(cutoff)) {
              expired.add(match);
            }
          }
          expired.forEach(this::removeMatchLocked);
          return expired.size();
        });
  }

  private Match createLocked(
      MatchKind kind,
      Currency currency,
      BigDecimal stake,
      String playerId,
      String sessionHandle,
      String account,
      String requestedMatchId) {
    final String matchId = stakePolicy.resolveMatchId(requestedMatchId, currency);
    final Match existing = matches.get(matchId);
    if (existing != null) {
      if (existing.isLive()) {
        throw new GameSessionException(
            GameErrorCode.MATCH_IN_PROGRESS, "match id already in use: " + matchId);
      }
      removeMatchLocked(existing);
    }
    final String previous = playerMatches.remove(playerId);
    if (previous != null) {
      logger.debug("player mapping replaced playerId={} previousMatchId={}", playerId, previous);
    }
    final Match match =
        new Match(matchId, kind, stakePolicy.terms(currency, stake), clock.instant());
    MatchRules.seat(match, playerId, sessionHandle, account);
    matches.put(matchId, match);
    playerMatches.put(playerId, matchId);
    logger.info(
        "match created matchId={} kind={} currency={} stake={} playerId={}",
        matchId,
        kind.value(),
        currency.value(),
        stake.toPlainString(),
        playerId);
    return match;
  }

  private Match requireJoinable(String matchId, String playerId) {
    final Match match = matches.get(matchId);
    if (match == null) {
      throw new GameSessionException(GameErrorCode.MATCH_NOT_FOUND, "match not found: " + matchId);
    }
    if (match.status() == MatchStatus.FINISHED) {
      throw new GameSessionException(
          GameErrorCode.MATCH_FINISHED, "match already finished: " + matchId);
    }
    if (match.status() == MatchStatus.ACTIVE) {
      throw new GameSessionException(
          GameErrorCode.MATCH_IN_PROGRESS, "match already in progress: " + matchId);
    }
    if (!match.hasOpenSlot() && !match.contains(playerId)) {
      throw new GameSessionException(GameErrorCode.MATCH_FULL, "match is full: " + matchId);
    }
    return match;
  }

  private JoinOutcome joinLocked(
      Match match, String playerId, String sessionHandle, String account) {
    final String previous = playerMatches.get(playerId);
    if (previous != null && !previous.equals(match.id())) {
      playerMatches.remove(playerId);
      logger.debug("player mapping replaced playerId={} previousMatchId={}", playerId, previous);
    }
    final SlotPosition position = MatchRules.seat(match, playerId, sessionHandle, account);
    for (String occupant : match.occupants()) {
      playerMatches.put(occupant, match.id());
    }
    final boolean started = match.status() == MatchStatus.ACTIVE;
    events.onPlayerJoined(match.toView(), playerId);
    if (started) {
      for (String occupant : match.occupants()) {
        queue.remove(occupant);
      }
      logger.info(
          "match started matchId={} player1={} player2={}",
          match.id(),
          match.slot(SlotPosition.PLAYER1).playerId(),
          match.slot(SlotPosition.PLAYER2).playerId());
      events.onMatchStarted(match.toView());
      armRound(match);
      scheduleGraceForDetached(match);
    }
    return new JoinOutcome(match.toView(), position, started);
  }

  /** 待機中に切断した参加者がいれば、開始時点から切断猶予の判定を始める。 */
  private void scheduleGraceForDetached(Match match) {
    for (String occupant : match.occupants()) {
      final Optional<SlotPosition> position = match.positionOf(occupant);
      if (position.isEmpty() || match.slot(position.get()).isConnected()) {
        continue;
      }
      logger.info(
          "match started with detached player playerId={} matchId={}", occupant, match.id());
      events.onPlayerDisconnected(match.toView(), occupant);
      final String matchId = match.id();
      graceHandler.schedule(occupant, () -> checkDisconnect(occupant, matchId));
    }
  }

  private void autoLeaveLocked(String playerId) {
    queue.remove(playerId);
    final Match match = mappedMatch(playerId);
    if (match == null) {
      playerMatches.remove(playerId);
      return;
    }
    if (match.isLive() && match.contains(playerId)) {
      logger.info(
          "leaving live match before random search playerId={} matchId={}", playerId, match.id());
      leaveLocked(playerId);
      return;
    }
    playerMatches.remove(playerId);
  }

  private RandomMatchOutcome randomLocked(RandomMatchCommand command, StakeRequest resolved) {
    final String playerId = command.playerId();
    for (Match candidate : matches.values()) {
      if (candidate.kind() == MatchKind.PUBLIC
          && candidate.status() == MatchStatus.WAITING_FOR_OPPONENT
          && candidate.hasOpenSlot()
          && !candidate.contains(playerId)
          && resolved.sameTermsAs(candidate.currency(), candidate.stake())) {
        final JoinOutcome joined =
            joinLocked(candidate, playerId, command.sessionHandle(), command.account());
        logger.info(
            "random match joined waiting match playerId={} matchId={}", playerId, candidate.id());
        return new RandomMatchOutcome(joined.match(), joined.started(), false);
      }
    }

    final Optional<MatchmakingTicket> partner =
        queue.pollMatching(resolved.currency(), resolved.stake(), playerId);
    if (partner.isPresent()) {
      final MatchmakingTicket ticket = partner.get();
      final Match match =
          createLocked(
              MatchKind.PUBLIC,
              resolved.currency(),
              resolved.stake(),
              ticket.playerId(),
              ticket.sessionHandle(),
              ticket.account(),
              null);
      final JoinOutcome joined =
          joinLocked(match, playerId, command.sessionHandle(), command.account());
      logger.info(
          "random match paired with queued player playerId={} partner={} matchId={}",
          playerId,
          ticket.playerId(),
          match.id());
      return new RandomMatchOutcome(joined.match(), joined.started(), false);
    }

    queue.enqueue(
        new MatchmakingTicket(
            playerId,
            command.sessionHandle(),
            resolved.stake(),
            resolved.currency(),
            command.account(),
            clock.instant()));
    final Match placeholder =
        createLocked(
            MatchKind.PUBLIC,
            resolved.currency(),
            resolved.stake(),
            playerId,
            command.sessionHandle(),
            command.account(),
            null);
    logger.info("random match queued playerId={} matchId={}", playerId, placeholder.id());
    return new RandomMatchOutcome(placeholder.toView(), false, true);
  }

  private Match locateForMove(String playerId, String matchHint) {
    final Match mapped = mappedMatch(playerId);
    if (mapped != null && mapped.contains(playerId)) {
      return mapped;
    }
    if (playerMatches.remove(playerId) != null) {
      logger.warn("dropped stale player mapping playerId={}", playerId);
    }
    final Match found =
        reconcile(playerId, matchHint)
            .orElseThrow(
                () ->
                    new GameSessionException(
                        GameErrorCode.PLAYER_NOT_IN_ANY_MATCH,
                        "player is not in any match: " + playerId));
    playerMatches.put(playerId, found.id());
    metrics.recordReconciliation();
    logger.warn("player mapping repaired by scan playerId={} matchId={}", playerId, found.id());
    return found;
  }

  /** 対応表に無いプレイヤーの所属を、指定マッチ、新しい ACTIVE マッチ、任意のマッチの順に探す。 */
  private Optional<Match> reconcile(String playerId, String matchHint) {
    if (matchHint != null) {
      final Match hinted = matches.get(matchHint);
      if (hinted != null
          && hinted.status() == MatchStatus.ACTIVE
          && hinted.contains(playerId)) {
        return Optional.of(hinted);
      }
    }
    final List<Match> recentFirst = new ArrayList<>(matches.values());
    Collections.reverse(recentFirst);
    for (Match match : recentFirst) {
      if (match.status() == MatchStatus.ACTIVE && match.contains(playerId)) {
        return Optional.of(match);
      }
    }
    for (Match match : recentFirst) {
      if (match.contains(playerId)) {
        return Optional.of(match);
      }
    }
    return Optional.empty();
  }

  private LeaveOutcome leaveLocked(String playerId) {
    final boolean ticketRemoved = queue.remove(playerId);
    final String matchId = playerMatches.remove(playerId);
    if (matchId == null) {
      throw new GameSessionException(
          GameErrorCode.PLAYER_NOT_IN_ANY_MATCH,
          ticketRemoved
              ? "player was only queued: " + playerId
              : "player is not in any match: " + playerId);
    }
    graceHandler.cancel(playerId);
    final Match match = matches.get(matchId);
    if (match == null) {
      throw new GameSessionException(GameErrorCode.MATCH_NOT_FOUND, "match not found: " + matchId);
    }
    final Optional<SlotPosition> position = match.positionOf(playerId);
    if (!match.isLive() || position.isEmpty()) {
      return new LeaveOutcome(matchId, match.toView());
    }

    final PlayerSlot slot = match.slot(position.get());
    final String leaverAccount = slot.account();
    final MatchStatus statusBefore = match.status();
    slot.clear();
    if (statusBefore == MatchStatus.WAITING_FOR_OPPONENT) {
      settlementDispatcher.refund(matchId, leaverAccount, match.stake());
    }
    if (match.isEmpty()) {
      match.finish(null, FinishReason.ABANDONED, clock.instant());
      completeMatch(match, null);
    } else if (statusBefore == MatchStatus.ACTIVE) {
      final PlayerSlot remaining = match.slot(position.get().opponent());
      match.finish(remaining.playerId(), FinishReason.FORFEIT_LEFT, clock.instant());
      completeMatch(match, leaverAccount);
    }
    logger.info(
        "player left match playerId={} matchId={} status={}", playerId, matchId, match.status());
    final MatchView view = match.toView();
    events.onPlayerLeft(view, playerId);
    return new LeaveOutcome(matchId, view);
  }

  private void handleRoundTimeout(Match match) {
    final PlayerSlot player1 = match.slot(SlotPosition.PLAYER1);
    final PlayerSlot player2 = match.slot(SlotPosition.PLAYER2);
    final boolean player1Missing = !player1.hasMove();
    final boolean player2Missing = !player2.hasMove();
    if (!player1Missing && !player2Missing) {
      roundTimer.cancel(match.id());
      return;
    }
    int assigned = 0;
    if (player1Missing && player2Missing) {
      final AutoMoveAssigner.MovePair pair = autoMoveAssigner.distinctPair();
      assigned += autoSubmit(match, SlotPosition.PLAYER1, pair.player1Move());
      assigned += autoSubmit(match, SlotPosition.PLAYER2, pair.player2Move());
    } else if (player1Missing) {
      assigned += autoSubmit(match, SlotPosition.PLAYER1, autoMoveAssigner.randomMove());
    } else {
      assigned += autoSubmit(match, SlotPosition.PLAYER2, autoMoveAssigner.randomMove());
    }
    metrics.recordAutoMoves(assigned);
    logger.info(
        "round timed out matchId={} round={} autoMoves={}",
        match.id(),
        match.currentRound(),
        assigned);
    resolveRound(match);
  }

  private int autoSubmit(Match match, SlotPosition position, Move move) {
    MatchRules.recordMove(match, position, move);
    events.onMoveSubmitted(match.toView(), match.slot(position).playerId(), move, true);
    return 1;
  }

  /** 直接投入とタイムアウトの両経路で共有するラウンド解決と後続処理。 */
  private ResolvedRound resolveRound(Match match) {
    roundTimer.cancel(match.id());
    final RoundResult result = MatchRules.processRound(match, clock.instant());
    metrics.recordRoundResolved(result.roundWinner().value());
    final MatchView snapshot = match.toView();
    events.onRoundCompleted(snapshot, result);
    if (result.matchFinished()) {
      final SlotPosition loser = result.matchWinner().opponent();
      completeMatch(match, match.slot(loser).account());
    } else {
      MatchRules.advanceRound(match);
      events.onNextRound(match.toView());
      armRound(match);
    }
    return new ResolvedRound(result, snapshot);
  }

  private void armRound(Match match) {
    roundTimer.arm(match.id(), match.currentRound(), this);
    events.onRoundTick(match.toView(), roundTimer.countdownTicks());
  }

  /**
   * 役割: FINISHED へ遷移したマッチの後処理を行う。
   * 動作: タイマー/猶予判定/チケットを片付け、勝者がいれば清算済みフラグを立ててから清算を依頼し、match_finished を通知する。
   * 前提: match.finish(...) 済みであること。清算済みフラグにより同一マッチの清算は 1 回に限られる。
   */
  private void completeMatch(Match match, String loserAccount) {
    roundTimer.cancel(match.id());
    for (String occupant : match.occupants()) {
      graceHandler.cancel(occupant);
      queue.remove(occupant);
    }
    final String reason = match.finishReason().name().toLowerCase(Locale.ROOT);
    metrics.recordMatchFinished(reason, Duration.between(match.createdAt(), match.finishedAt()));
    if (match.winner() != null && match.markSettled()) {
      settlementDispatcher.settle(match.toView(), winnerAccount(match), loserAccount);
    }
    logger.info(
        "match finished matchId={} winner={} reason={} rounds={}",
        match.id(),
        match.winner(),
        reason,
        match.completedRounds());
    events.onMatchFinished(match.toView());
  }

  private String winnerAccount(Match match) {
    return match
        .positionOf(match.winner())
        .map(position -> match.slot(position).account())
        .orElse(null);
  }

  private Match currentRoundMatch(String matchId, int round) {
    final Match match = matches.get(matchId);
    if (match == null
        || match.status() != MatchStatus.ACTIVE
        || match.currentRound() != round
        || !roundTimer.isArmed(matchId, round)) {
      return null;
    }
    return match;
  }

  private Match mappedMatch(String playerId) {
    final String matchId = playerMatches.get(playerId);
    return matchId == null ? null : matches.get(matchId);
  }

  private void removeMatchLocked(Match match) {
    matches.remove(match.id());
    roundTimer.cancel(match.id());
    playerMatches.values().removeIf(match.id()::equals);
  }

  private boolean requiresBalanceCheck(Currency currency, String account) {
    return currency == Currency.POINTS && account != null && !account.isBlank();
  }

  private static void requirePlayerId(String playerId) {
    if (playerId == null || playerId.isBlank()) {
      throw new GameSessionException(GameErrorCode.INVALID_REQUEST, "playerId is required");
    }
  }

  private <T> T locked(Supplier<T> action) {
    lock.lock();
    try {
      return action.get();
    } finally {
      publishGauges();
      lock.unlock();
    }
  }

  private void lockedRun(Runnable action) {
    locked(
        () -> {
          action.run();
          return null;
        });
  }

  private <T> T read(Supplier<T> action) {
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  private void publishGauges() {
    long waiting = 0;
    long active = 0;
    long finished = 0;
    for (Match match : matches.values()) {
      switch (match.status()) {
        case WAITING_FOR_OPPONENT -> waiting++;
        case ACTIVE -> active++;
        case FINISHED -> finished++;
      }
    }
    metrics.updateMatchCount("waiting", waiting);
    metrics.updateMatchCount("active", active);
    metrics.updateMatchCount("finished", finished);
    metrics.updateQueueDepth(queue.size());
    metrics.updateLiveTimers(roundTimer.liveTimers());
  }

  private record JoinPrecheck(Currency currency, BigDecimal stake, boolean alreadySeated) {}

  private record ResolvedRound(RoundResult result, MatchView snapshot) {}
}
