/*
 * どこで: Squad ドメインモデル
 * 何を: 告知バッチ publish の結果を表現する
 * なぜ: 配信済み/重複抑止/配信失敗をメトリクスとテストで区別するため
 */
package com.example.squad_announcer.model;

import java.util.Locale;

public enum PublishResult {
  DELIVERED,
  SUPPRESSED,
  FAILED;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
