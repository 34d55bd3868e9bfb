/*
 * どこで: Squad サービス層
 * 何を: テナントの活動セッションと待機グループを読み取り専用で取り出す
 * なぜ: デバッグ API から状態ストアを直接触らせないため
 */
package com.example.squad_announcer.service;

import com.example.squad_announcer.api.response.TrackingStatusResponse;
import com.example.squad_announcer.model.PendingGroup;
import com.example.squad_announcer.model.SessionEnded;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TrackingStatusService {

  private final TenantStateStore stateStore;

  public TrackingStatusResponse snapshot(String tenantId) {
    return stateStore.withTenant(
        tenantId,
        partition -> {
          final List<TrackingStatusResponse.SessionView> sessions =
              partition.sessionsSnapshot().entrySet().stream()
                  .sorted(Map.Entry.comparingByKey())
                  .map(
                      entry ->
                          new TrackingStatusResponse.SessionView(
                              entry.getKey(),
                              entry.getValue().state().name(),
                              entry.getValue().startedAt().toString(),
                              entry.getValue().voiceChannelId(),
                              entry.getValue().streaming()))
                  .toList();
          final List<TrackingStatusResponse.PendingGroupView> groups =
              partition.pendingGroups().stream()
                  .sorted(Comparator.comparing(PendingGroup::createdAt))
                  .map(
                      group ->
                          new TrackingStatusResponse.PendingGroupView(
                              group.key().channelKey(),
                              group.members().stream().map(SessionEnded::userId).toList(),
                              group.createdAt().toString(),
                              group.deadline().toString()))
                  .toList();
          return new TrackingStatusResponse(tenantId, sessions, groups);
        });
  }
}
