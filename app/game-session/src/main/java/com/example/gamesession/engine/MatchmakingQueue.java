/*
 * どこで: Game Session エンジン
 * 何を: ランダムマッチ待機チケットの FIFO キュー
 * なぜ: 同じ stake/currency の相手を先着順で組み合わせるため
 */
package com.example.gamesession.engine;

import com.example.gamesession.model.Currency;
import com.example.gamesession.model.MatchmakingTicket;
import java.math.BigDecimal;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** SessionRegistry のロック内でのみ使う。プレイヤーごとにチケットは最大 1 枚。 */
public class MatchmakingQueue {

  private final Map<String, MatchmakingTicket> tickets = new LinkedHashMap<>();

  /** 既存チケットは置き換え、末尾へ移動する。 */
  public void enqueue(MatchmakingTicket ticket) {
    tickets.remove(ticket.playerId());
    tickets.put(ticket.playerId(), ticket);
  }

  /** 条件が一致する最古のチケットを取り出す。自分自身とは組まない。 */
  public Optional<MatchmakingTicket> pollMatching(
      Currency currency, BigDecimal stake, String excludePlayerId) {
    final Iterator<MatchmakingTicket> iterator = tickets.values().iterator();
    while (iterator.hasNext()) {
      final MatchmakingTicket ticket = iterator.next();
      if (ticket.pairsWith(currency, stake, excludePlayerId)) {
        iterator.remove();
        return Optional.of(ticket);
      }
    }
    return Optional.empty();
  }

  public boolean remove(String playerId) {
    return tickets.remove(playerId) != null;
  }

  public boolean contains(String playerId) {
    return tickets.containsKey(playerId);
  }

  public int size() {
    return tickets.size();
  }

  public List<MatchmakingTicket> snapshot() {
    return List.copyOf(tickets.values());
  }
}
