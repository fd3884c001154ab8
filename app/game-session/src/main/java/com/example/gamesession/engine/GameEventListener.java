package com.example.gamesession.engine;

import com.example.gamesession.model.MatchView;
import com.example.gamesession.model.Move;
import com.example.gamesession.model.RoundResult;

/**
 * SessionRegistry の状態変化を通知する出力ポート。
 *
 * <p>呼び出しはレジストリのロック保持中に、状態変化と同じ順序で行われる。実装は I/O を直接行わないこと。
 */
public interface GameEventListener {

  void onPlayerJoined(MatchView match, String playerId);

  void onMatchStarted(MatchView match);

  void onRoundTick(MatchView match, int countdown);

  void onMoveSubmitted(MatchView match, String playerId, Move move, boolean autoAssigned);

  void onRoundCompleted(MatchView match, RoundResult result);

  void onNextRound(MatchView match);

  void onMatchFinished(MatchView match);

  void onPlayerLeft(MatchView match, String playerId);

  void onPlayerDisconnected(MatchView match, String playerId);
}
