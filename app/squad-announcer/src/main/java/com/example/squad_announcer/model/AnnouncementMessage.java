/*
 * どこで: Squad ドメインモデル
 * 何を: 描画済みの告知 (タイトル, 色, フィールド, フッター, 宛先ユーザ) を表現する
 * なぜ: 描画ロジックと配信先 (Discord/ログ) を分離するため
 */
package com.example.squad_announcer.model;

import java.time.Instant;
import java.util.List;

public record AnnouncementMessage(
    String tenantId,
    String matchId,
    String title,
    int color,
    List<Field> fields,
    String footer,
    List<String> mentionUserIds,
    Instant timestamp) {

  public AnnouncementMessage {
    fields = List.copyOf(fields);
    mentionUserIds = List.copyOf(mentionUserIds);
  }

  public record Field(String name, String value, boolean inline) {}
}
