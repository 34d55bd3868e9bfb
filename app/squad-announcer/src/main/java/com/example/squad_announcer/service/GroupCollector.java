/*
 * どこで: Squad サービス層
 * 何を: SessionEnded をボイスチャンネル (無ければ個人キー) 単位にまとめ、窓満了で解決へ渡す
 * なぜ: 同じ試合を終えた仲間の終了信号が揃うまで待ってから 1 回で照合するため
 */
package com.example.squad_announcer.service;

import com.example.squad_announcer.config.SquadTrackingProperties;
import com.example.squad_announcer.model.FinalizedGroup;
import com.example.squad_announcer.model.GroupKey;
import com.example.squad_announcer.model.PendingGroup;
import com.example.squad_announcer.model.SessionEnded;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class GroupCollector {

  private static final Logger logger = LoggerFactory.getLogger(GroupCollector.class);

  private final TenantStateStore stateStore;
  private final GroupTimer groupTimer;
  private final GroupFinalizedListener listener;
  private final SquadTrackingProperties properties;
  private final AnnouncementMetrics metrics;
  private final Clock clock;

  /**
   * 役割: 終了イベントを待機グループへ追加し、締切タイマーを張り直す。
   * 動作: 初回は now + groupWaitTime、以降は now + groupWaitTime へ延長するが createdAt + maxGroupWait を超えない。
   */
  public void onSessionEnded(SessionEnded event) {
    final GroupKey key = GroupKey.forSession(event);
    final Instant now = Instant.now(clock);
    final PendingGroup group =
        stateStore.withTenant(
            event.tenantId(),
            partition -> {
              final PendingGroup target =
                  partition
                      .pendingGroup(key)
                      .orElseGet(
                          () -> {
                            final PendingGroup created =
                                new PendingGroup(key, now, properties.groupWaitTime());
                            partition.putPendingGroup(created);
                            return created;
                          });
              final Instant deadline =
                  target.add(event, now, properties.groupWaitTime(), properties.maxGroupWait());
              // ロック内で予約し、締切の新旧とタイマーの新旧を一致させる
              groupTimer.schedule(key, deadline, () -> onWindowExpired(key));
              return target;
            });
    metrics.updatePendingGroups(stateStore.totalPendingGroups());
    logger.info(
        "session queued for group groupKey={} userId={} members={} deadline={}",
        key,
        event.userId(),
        group.size(),
        group.deadline());
  }

  /**
   * 役割: 締切到来時に待機グループを取り外し、解決へ受け渡す。
   * 動作: 締切前の古い発火は現在の締切で張り直して終了する。取り外し後に同じキーへ来た終了イベントは新しいグループになる。
   */
  public void onWindowExpired(GroupKey key) {
    final Instant now = Instant.now(clock);
    final Optional<PendingGroup> expired =
        stateStore.withTenant(
            key.tenantId(),
            partition -> {
              final Optional<PendingGroup> current = partition.pendingGroup(key);
              if (current.isEmpty()) {
                return Optional.<PendingGroup>empty();
              }
              final PendingGroup group = current.get();
              if (!group.expiredAt(now)) {
                groupTimer.schedule(key, group.deadline(), () -> onWindowExpired(key));
                return Optional.<PendingGroup>empty();
              }
              partition.removePendingGroup(key);
              return Optional.of(group);
            });
    if (expired.isEmpty()) {
      logger.debug("stale group timer ignored groupKey={}", key);
      return;
    }
    final PendingGroup group = expired.get();
    metrics.recordGroupFinalized();
    metrics.updatePendingGroups(stateStore.totalPendingGroups());
    logger.info("group window closed groupKey={} members={}", key, group.size());
    listener.onGroupFinalized(new FinalizedGroup(key, group.members(), now));
  }
}
