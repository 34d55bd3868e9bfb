/*
 * どこで: Squad ドメインモデル
 * 何を: 窓が閉じて解決サイクルへ引き渡される確定メンバー集合
 * なぜ: 引き渡し後にメンバーが追加されないことを不変値で表すため
 */
package com.example.squad_announcer.model;

import java.time.Instant;
import java.util.List;

public record FinalizedGroup(GroupKey key, List<SessionEnded> members, Instant finalizedAt) {

  public FinalizedGroup {
    members = List.copyOf(members);
  }

  public String tenantId() {
    return key.tenantId();
  }
}
