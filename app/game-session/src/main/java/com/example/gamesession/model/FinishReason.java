package com.example.gamesession.model;

public enum FinishReason {
  COMPLETED,
  FORFEIT_LEFT,
  FORFEIT_DISCONNECT,
  ABANDONED
}
