package com.example.gamesession.profile;

public class ProfileStoreException extends RuntimeException {

  public enum Reason {
    UNAUTHORIZED,
    NOT_FOUND,
    BAD_GATEWAY,
    TIMEOUT,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public ProfileStoreException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public ProfileStoreException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
