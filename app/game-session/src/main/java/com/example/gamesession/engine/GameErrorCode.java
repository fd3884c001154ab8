package com.example.gamesession.engine;

public enum GameErrorCode {
  INVALID_MOVE,
  MATCH_NOT_FOUND,
  PLAYER_NOT_IN_ANY_MATCH,
  MATCH_FULL,
  MATCH_FINISHED,
  MATCH_IN_PROGRESS,
  MATCH_NOT_STARTED,
  INVALID_STAKE,
  INSUFFICIENT_BALANCE,
  SETTLEMENT_NOTIFY_FAILED,
  INVALID_REQUEST
}
