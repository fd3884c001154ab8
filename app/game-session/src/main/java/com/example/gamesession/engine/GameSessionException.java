package com.example.gamesession.engine;

/** セッション操作の検証エラー。WebSocket では error メッセージ、REST ではステータスへ変換される。 */
public class GameSessionException extends RuntimeException {

  private final GameErrorCode code;

  public GameSessionException(GameErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public GameErrorCode getCode() {
    return code;
  }
}
