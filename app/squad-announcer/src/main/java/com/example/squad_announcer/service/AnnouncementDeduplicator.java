/*
 * どこで: Squad サービス層
 * 何を: 告知済み試合のメンバーを除外して配信し、配信成功後に台帳を更新する
 * なぜ: (tenant, 試合, ユーザー) ごとに告知を高々 1 回に抑えるため
 */
package com.example.squad_announcer.service;

import com.example.squad_announcer.model.AnnouncementBatch;
import com.example.squad_announcer.model.BatchMember;
import com.example.squad_announcer.model.PublishResult;
import com.example.squad_announcer.repository.AnnouncementLedgerRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AnnouncementDeduplicator {

  private static final Logger logger = LoggerFactory.getLogger(AnnouncementDeduplicator.class);

  private final AnnouncementLedgerRepository ledgerRepository;
  private final AnnouncementSender sender;
  private final TenantStateStore stateStore;
  private final AnnouncementMetrics metrics;
  private final Clock clock;

  /**
   * 役割: バッチを配信する。
   * 動作: 台帳の最終告知 matchId が一致するメンバーを除外し、空なら SUPPRESSED。
   *       配信失敗は FAILED で台帳は更新しない。同一テナントの配信は直列化する。
   */
  public PublishResult publish(AnnouncementBatch batch) {
    final PublishResult result =
        stateStore.withDeliveryLock(batch.tenantId(), () -> publishLocked(batch));
    metrics.recordAnnouncement(result);
    return result;
  }

  private PublishResult publishLocked(AnnouncementBatch batch) {
    final List<String> userIds = batch.members().stream().map(BatchMember::userId).toList();
    final Map<String, String> lastAnnounced =
        ledgerRepository.findLastMatchIds(batch.tenantId(), userIds);
    final List<BatchMember> remaining =
        batch.members().stream()
            .filter(member -> !batch.matchId().equals(lastAnnounced.get(member.userId())))
            .toList();
    if (remaining.isEmpty()) {
      logger.info(
          "announcement suppressed tenantId={} matchId={} members={}",
          batch.tenantId(),
          batch.matchId(),
          userIds.size());
      return PublishResult.SUPPRESSED;
    }
    final AnnouncementBatch filtered = batch.withMembers(remaining);
    try {
      sender.send(filtered);
    } catch (AnnouncementDeliveryException ex) {
      logger.warn(
          "announcement delivery failed tenantId={} matchId={} reason={}",
          batch.tenantId(),
          batch.matchId(),
          ex.reason(),
          ex);
      return PublishResult.FAILED;
    }
    final List<String> delivered = remaining.stream().map(BatchMember::userId).toList();
    ledgerRepository.recordAnnounced(
        batch.tenantId(), delivered, batch.matchId(), Instant.now(clock));
    logger.info(
        "announcement delivered tenantId={} matchId={} members={} skipped={}",
        batch.tenantId(),
        batch.matchId(),
        delivered.size(),
        userIds.size() - delivered.size());
    return PublishResult.DELIVERED;
  }
}
