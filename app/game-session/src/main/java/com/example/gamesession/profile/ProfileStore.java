package com.example.gamesession.profile;

import com.example.gamesession.model.MatchSummary;
import java.math.BigDecimal;

/** プロフィール/残高サービスへの出力ポート。永続化そのものはこのサービスの責務外。 */
public interface ProfileStore {

  boolean hasSufficientBalance(String account, BigDecimal amount);

  void refund(String account, BigDecimal amount, String matchId);

  void recordHistory(MatchSummary summary);
}
