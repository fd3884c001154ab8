/*
 * どこで: Game Session API
 * 何を: マッチ状態/プレイヤー所属/統計の参照エンドポイントを公開する
 * なぜ: 運用やクライアント再同期のために WebSocket を介さず状態を読めるようにするため
 */
package com.example.gamesession.api;

import com.example.gamesession.engine.GameErrorCode;
import com.example.gamesession.engine.GameSessionException;
import com.example.gamesession.engine.SessionRegistry;
import com.example.gamesession.model.MatchView;
import com.example.gamesession.model.RegistryStats;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class GameSessionController {

  private final SessionRegistry sessionRegistry;

  @GetMapping("/matches/{matchId}")
  public ResponseEntity<MatchView> getMatch(
      @PathVariable("matchId") @NotBlank @Size(max = 64) String matchId) {
    final MatchView match =
        sessionRegistry
            .getMatch(matchId)
            .orElseThrow(
                () ->
                    new GameSessionException(
                        GameErrorCode.MATCH_NOT_FOUND, "match not found: " + matchId));
    return ResponseEntity.ok(match);
  }

  @GetMapping("/players/{playerId}/match")
  public ResponseEntity<MatchView> getPlayerMatch(
      @PathVariable("playerId") @NotBlank @Size(max = 64) String playerId) {
    final MatchView match =
        sessionRegistry
            .getPlayerMatch(playerId)
            .orElseThrow(
                () ->
                    new GameSessionException(
                        GameErrorCode.PLAYER_NOT_IN_ANY_MATCH,
                        "player is not in any match: " + playerId));
    return ResponseEntity.ok(match.withOpponentMoveHidden(playerId));
  }

  @GetMapping("/stats")
  public ResponseEntity<RegistryStats> getStats() {
    return ResponseEntity.ok(sessionRegistry.stats());
  }
}
