/*
 * どこで: Squad サービス層
 * 何を: テナント単位に分割した活動セッションと待機グループを保持する
 * なぜ: テナント間で状態を共有せず、テナント内の変更だけを直列化するため
 */
package com.example.squad_announcer.service;

import com.example.squad_announcer.model.ActivitySession;
import com.example.squad_announcer.model.GroupKey;
import com.example.squad_announcer.model.PendingGroup;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

@Component
public class TenantStateStore {

  private final ConcurrentMap<String, TenantPartition> partitions = new ConcurrentHashMap<>();

  /**
   * 役割: テナントの状態ロックを取得した上で action を実行する。
   * 動作: 同一テナントの呼び出しは直列化され、別テナントは互いに待たない。
   * 前提: action 内でブロッキング I/O を行わないこと。
   */
  public <T> T withTenant(String tenantId, Function<TenantPartition, T> action) {
    final TenantPartition partition = partition(tenantId);
    partition.stateLock.lock();
    try {
      return action.apply(partition);
    } finally {
      partition.stateLock.unlock();
    }
  }

  /** 配信と台帳更新をテナント単位で直列化する。状態ロックとは独立している。 */
  public <T> T withDeliveryLock(String tenantId, Supplier<T> action) {
    final TenantPartition partition = partition(tenantId);
    partition.deliveryLock.lock();
    try {
      return action.get();
    } finally {
      partition.deliveryLock.unlock();
    }
  }

  public List<String> tenantIds() {
    return List.copyOf(partitions.keySet());
  }

  public int totalSessions() {
    return partitions.keySet().stream()
        .mapToInt(tenantId -> withTenant(tenantId, TenantPartition::sessionCount))
        .sum();
  }

  public int totalPendingGroups() {
    return partitions.keySet().stream()
        .mapToInt(tenantId -> withTenant(tenantId, TenantPartition::pendingGroupCount))
        .sum();
  }

  private TenantPartition partition(String tenantId) {
    if (tenantId == null || tenantId.isBlank()) {
      throw new IllegalArgumentException("tenantId is required");
    }
    return partitions.computeIfAbsent(tenantId, TenantPartition::new);
  }

  /** テナントロック下でのみ触れる可変状態。ロック外へ参照を持ち出さないこと。 */
  public static final class TenantPartition {

    private final String tenantId;
    private final ReentrantLock stateLock = new ReentrantLock();
    private final ReentrantLock deliveryLock = new ReentrantLock();
    // セッションが無いユーザーは IDLE とみなす
    private final Map<String, ActivitySession> sessions = new HashMap<>();
    private final Map<GroupKey, PendingGroup> pendingGroups = new HashMap<>();

    private TenantPartition(String tenantId) {
      this.tenantId = tenantId;
    }

    public String tenantId() {
      return tenantId;
    }

    public Optional<ActivitySession> session(String userId) {
      return Optional.ofNullable(sessions.get(userId));
    }

    public void putSession(String userId, ActivitySession session) {
      sessions.put(userId, session);
    }

    public boolean removeSession(String userId) {
      return sessions.remove(userId) != null;
    }

    public Map<String, ActivitySession> sessionsSnapshot() {
      return Map.copyOf(sessions);
    }

    public int sessionCount() {
      return sessions.size();
    }

    public Optional<PendingGroup> pendingGroup(GroupKey key) {
      return Optional.ofNullable(pendingGroups.get(key));
    }

    public void putPendingGroup(PendingGroup group) {
      pendingGroups.put(group.key(), group);
    }

    public Optional<PendingGroup> removePendingGroup(GroupKey key) {
      return Optional.ofNullable(pendingGroups.remove(key));
    }

    public List<PendingGroup> pendingGroups() {
      return List.copyOf(pendingGroups.values());
    }

    public int pendingGroupCount() {
      return pendingGroups.size();
    }
  }
}
