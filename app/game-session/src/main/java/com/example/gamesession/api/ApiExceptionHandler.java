package com.example.gamesession.api;

import com.example.gamesession.engine.GameErrorCode;
import com.example.gamesession.engine.GameSessionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(GameSessionException.class)
  public ResponseEntity<ApiErrorResponse> handleGameSession(GameSessionException ex) {
    return ResponseEntity.status(statusOf(ex.getCode()))
        .body(new ApiErrorResponse(ex.getCode().name(), ex.getMessage()));
  }

  @ExceptionHandler(HandlerMethodValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(HandlerMethodValidationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            new ApiErrorResponse(GameErrorCode.INVALID_REQUEST.name(), "request validation failed"));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled api error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("GAME_INTERNAL_ERROR", ex.getMessage()));
  }

  static HttpStatus statusOf(GameErrorCode code) {
    return switch (code) {
      case MATCH_NOT_FOUND, PLAYER_NOT_IN_ANY_MATCH -> HttpStatus.NOT_FOUND;
      case INVALID_MOVE, INVALID_STAKE, INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
      case MATCH_FULL, MATCH_FINISHED, MATCH_IN_PROGRESS, MATCH_NOT_STARTED -> HttpStatus.CONFLICT;
      case INSUFFICIENT_BALANCE -> HttpStatus.PAYMENT_REQUIRED;
      case SETTLEMENT_NOTIFY_FAILED -> HttpStatus.BAD_GATEWAY;
    };
  }
}
