/*
 * どこで: Squad API レスポンス DTO
 * 何を: テナント内の活動セッションと待機グループのスナップショットを定義する
 * なぜ: 窓やセッションが滞留していないかを運用で確認するため
 */
package com.example.squad_announcer.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TrackingStatusResponse(
    String tenantId, List<SessionView> sessions, List<PendingGroupView> pendingGroups) {

  public TrackingStatusResponse {
    sessions = List.copyOf(sessions);
    pendingGroups = List.copyOf(pendingGroups);
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record SessionView(
      String userId, String state, String startedAt, String voiceChannelId, boolean streaming) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record PendingGroupView(
      String groupKey, List<String> userIds, String createdAt, String deadline) {}
}
