package com.example.gamesession.settlement;

import java.math.BigDecimal;

/** 決着したマッチを清算側へ通知する出力ポート。1 マッチにつき高々 1 回呼ばれる。 */
public interface SettlementNotifier {

  /**
   * 役割: 勝者/敗者アカウントとステークを清算側へ渡す。
   * 動作: 受理されたら true、受理されなかったら false を返す。通信障害は例外で通知してよい。
   */
  boolean notifyMatchSettled(
      String matchId, String winnerAccount, String loserAccount, BigDecimal stake);
}
