/*
 * どこで: Squad API
 * 何を: 直近履歴にコンペティティブ試合が無いことを表現する
 * なぜ: 統計/直近試合照会の 404 応答へ変換するため
 */
package com.example.squad_announcer.api;

public class CompetitiveMatchNotFoundException extends RuntimeException {
  public CompetitiveMatchNotFoundException(String riotId) {
    super("no recent competitive match: " + riotId);
  }
}
