/*
 * どこで: Squad ドメインモデル
 * 何を: 1 解決サイクルの結果 (告知バッチ列と除外メンバー列)
 * なぜ: ログに埋もれがちな除外理由をテストと呼び出し側から検証できる値にするため
 */
package com.example.squad_announcer.model;

import java.util.List;

public record ResolutionOutcome(
    String tenantId, List<AnnouncementBatch> batches, List<DroppedMember> dropped) {

  public ResolutionOutcome {
    batches = List.copyOf(batches);
    dropped = List.copyOf(dropped);
  }
}
