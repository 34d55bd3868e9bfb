/*
 * どこで: Squad ドメインモデル
 * 何を: 1 テナント・1 試合ぶんの告知対象メンバー列
 * なぜ: 重複排除と配信の単位を固定するため
 */
package com.example.squad_announcer.model;

import java.util.List;

public record AnnouncementBatch(String tenantId, MatchRecord match, List<BatchMember> members) {

  public AnnouncementBatch {
    members = List.copyOf(members);
  }

  public String matchId() {
    return match.matchId();
  }

  public AnnouncementBatch withMembers(List<BatchMember> remaining) {
    return new AnnouncementBatch(tenantId, match, remaining);
  }

  public boolean empty() {
    return members.isEmpty();
  }
}
