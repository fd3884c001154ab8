package com.example.gamesession.engine;

import com.example.gamesession.model.MatchView;

/** queued=true はキューへ登録し待機マッチを作成したことを示す。 */
public record RandomMatchOutcome(MatchView match, boolean started, boolean queued) {}
