/*
 * どこで: Squad ドメインモデル
 * 何を: 1 試合における 1 選手の成績
 * なぜ: 告知に必要な情報 (エージェント, K/D/A, 勝敗, チーム) を試合レコードから切り出すため
 */
package com.example.squad_announcer.model;

public record PlayerStats(
    String riotName,
    String riotTag,
    String team,
    String agent,
    int kills,
    int deaths,
    int assists,
    boolean won) {

  public String accountKey() {
    return Registration.accountKey(riotName, riotTag);
  }

  public double kda() {
    return (double) (kills + assists) / Math.max(deaths, 1);
  }
}
