/*
 * どこで: Squad ドメインモデル
 * 何を: 試合データ提供元から取得した 1 試合の不変スナップショット
 * なぜ: squad 照合 (matchId) と告知描画 (map/mode/score/成績) の共通入力とするため
 */
package com.example.squad_announcer.model;

import java.util.Map;
import java.util.Optional;

public record MatchRecord(
    String matchId,
    String mode,
    String map,
    int redRounds,
    int blueRounds,
    Map<String, PlayerStats> playersByAccount) {

  public static final String COMPETITIVE_MODE = "competitive";

  public MatchRecord {
    playersByAccount = Map.copyOf(playersByAccount);
  }

  public boolean competitive() {
    return COMPETITIVE_MODE.equalsIgnoreCase(mode);
  }

  public Optional<PlayerStats> statsFor(String accountKey) {
    return Optional.ofNullable(playersByAccount.get(accountKey));
  }
}
