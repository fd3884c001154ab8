package com.example.gamesession.engine;

import com.example.gamesession.model.Move;
import java.util.random.RandomGenerator;

/** タイムアウト時の自動手を選ぶ。乱数源は注入してテストで固定できるようにする。 */
public class AutoMoveAssigner {

  private static final Move[] MOVES = Move.values();

  private final RandomGenerator random;

  public AutoMoveAssigner(RandomGenerator random) {
    this.random = random;
  }

  public Move randomMove() {
    return MOVES[random.nextInt(MOVES.length)];
  }

  /** 両者未投入の場合に使う。必ず異なる 2 手を返すため引き分けにならない。 */
  public MovePair distinctPair() {
    final int first = random.nextInt(MOVES.length);
    final int offset = 1 + random.nextInt(MOVES.length - 1);
    return new MovePair(MOVES[first], MOVES[(first + offset) % MOVES.length]);
  }

  public record MovePair(Move player1Move, Move player2Move) {}
}
