package com.example.gamesession.engine;

import com.example.gamesession.model.StakeRequest;

/** ランダムマッチ要求の通貨/ステークを確定するフック。 */
public interface CurrencyFallbackPolicy {

  /**
   * 役割: 要求された通貨/ステークを、実際に対戦へ使う値へ確定する。
   * 動作: 残高不足などで要求を満たせない場合、別通貨へ切り替えるか INSUFFICIENT_BALANCE を送出する。
   * 前提: account は null の場合がある（残高確認なし）。
   */
  StakeRequest resolve(StakeRequest requested, String account);
}
