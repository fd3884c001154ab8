package com.example.gamesession.model;

/** マッチ内の 1 座席。Match と同じく SessionRegistry の排他区間内でのみ変更される。 */
public final class PlayerSlot {

  private String playerId;
  private String sessionHandle;
  private String account;
  private int wins;
  private Move currentMove;
  private boolean ready;
  private boolean stakeDeposited;

  public boolean isOccupied() {
    return playerId != null;
  }

  public void occupy(String playerId, String sessionHandle, String account) {
    this.playerId = playerId;
    this.sessionHandle = sessionHandle;
    this.account = account;
    this.wins = 0;
    this.currentMove = null;
    this.ready = false;
    this.stakeDeposited = false;
  }

  /** 同一プレイヤーの再着席。勝数は保持し、未確定の手だけ捨てる。 */
  public void reattach(String sessionHandle, String account) {
    this.sessionHandle = sessionHandle;
    if (account != null) {
      this.account = account;
    }
    this.currentMove = null;
    this.ready = false;
  }

  public void clear() {
    playerId = null;
    sessionHandle = null;
    account = null;
    wins = 0;
    currentMove = null;
    ready = false;
    stakeDeposited = false;
  }

  public void submit(Move move) {
    this.currentMove = move;
    this.ready = true;
  }

  public void resetRound() {
    this.currentMove = null;
    this.ready = false;
  }

  public void recordWin() {
    wins++;
  }

  public void attachSession(String sessionHandle) {
    this.sessionHandle = sessionHandle;
  }

  public void detachSession() {
    this.sessionHandle = null;
  }

  public void markStakeDeposited() {
    this.stakeDeposited = true;
  }

  public boolean hasMove() {
    return currentMove != null;
  }

  public boolean isConnected() {
    return sessionHandle != null;
  }

  public String playerId() {
    return playerId;
  }

  public String sessionHandle() {
    return sessionHandle;
  }

  public String account() {
    return account;
  }

  public int wins() {
    return wins;
  }

  public Move currentMove() {
    return currentMove;
  }

  public boolean ready() {
    return ready;
  }

  public boolean stakeDeposited() {
    return stakeDeposited;
  }

  public PlayerView toView() {
    return new PlayerView(
        playerId, account, wins, currentMove, ready, stakeDeposited, isConnected());
  }
}
