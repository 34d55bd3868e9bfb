/*
 * どこで: Squad ドメインモデル
 * 何を: テナント内でのユーザと Riot アカウントの対応を表現する
 * なぜ: 試合データ取得と試合内の選手照合のキーをまとめるため
 */
package com.example.squad_announcer.model;

import java.time.Instant;
import java.util.Locale;

public record Registration(
    String tenantId,
    String userId,
    String riotName,
    String riotTag,
    Region region,
    Instant registeredAt) {

  public String accountKey() {
    return accountKey(riotName, riotTag);
  }

  public String riotId() {
    return riotName + "#" + riotTag;
  }

  public static String accountKey(String riotName, String riotTag) {
    return (riotName + "#" + riotTag).toLowerCase(Locale.ROOT);
  }
}
