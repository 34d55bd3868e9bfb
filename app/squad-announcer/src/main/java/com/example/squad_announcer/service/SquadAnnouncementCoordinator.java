/*
 * どこで: Squad サービス層
 * 何を: 窓が閉じたグループの解決と告知を専用 Executor 上で 1 サイクル実行する
 * なぜ: API 反映待ちや HTTP の待ちをタイマー/NATS スレッドから切り離すため
 */
package com.example.squad_announcer.service;

import com.example.common.TraceIds;
import com.example.squad_announcer.model.AnnouncementBatch;
import com.example.squad_announcer.model.FinalizedGroup;
import com.example.squad_announcer.model.PublishResult;
import com.example.squad_announcer.model.ResolutionOutcome;
import com.example.squad_announcer.model.SessionEnded;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class SquadAnnouncementCoordinator implements GroupFinalizedListener {

  private static final Logger logger = LoggerFactory.getLogger(SquadAnnouncementCoordinator.class);

  private final SquadResolver squadResolver;
  private final AnnouncementDeduplicator deduplicator;
  private final ActivityTracker activityTracker;
  private final AnnouncementMetrics metrics;
  private final Executor resolutionExecutor;
  private final Clock clock;

  public SquadAnnouncementCoordinator(
      SquadResolver squadResolver,
      AnnouncementDeduplicator deduplicator,
      ActivityTracker activityTracker,
      AnnouncementMetrics metrics,
      @Qualifier("resolutionExecutor") Executor resolutionExecutor,
      Clock clock) {
    this.squadResolver = squadResolver;
    this.deduplicator = deduplicator;
    this.activityTracker = activityTracker;
    this.metrics = metrics;
    this.resolutionExecutor = resolutionExecutor;
    this.clock = clock;
  }

  @Override
  public void onGroupFinalized(FinalizedGroup group) {
    try {
      resolutionExecutor.execute(() -> runCycle(group));
    } catch (RejectedExecutionException ex) {
      // 解決に入れなかったメンバーも PENDING_RESOLUTION に残さない
      logger.error(
          "resolution rejected groupKey={} members={}", group.key(), group.members().size(), ex);
      activityTracker.release(
          group.tenantId(), group.members().stream().map(SessionEnded::userId).toList());
    }
  }

  /** 解決から告知までを呼び出しスレッドで実行する。 */
  public List<PublishResult> runCycle(FinalizedGroup group) {
    MDC.put("trace_id", TraceIds.newTraceId());
    MDC.put("tenant_id", group.tenantId());
    MDC.put("group_key", group.key().channelKey());
    final Instant startedAt = Instant.now(clock);
    final List<PublishResult> results = new ArrayList<>();
    try {
      final ResolutionOutcome outcome = squadResolver.resolve(group.tenantId(), group.members());
      for (AnnouncementBatch batch : outcome.batches()) {
        try {
          results.add(deduplicator.publish(batch));
        } catch (RuntimeException ex) {
          // 台帳 I/O の失敗などはこのバッチだけに閉じ込める
          logger.error("announcement publish failed matchId={}", batch.matchId(), ex);
          metrics.recordAnnouncement(PublishResult.FAILED);
          results.add(PublishResult.FAILED);
        }
      }
      logger.info(
          "resolution cycle completed members={} batches={} dropped={} results={}",
          group.members().size(),
          outcome.batches().size(),
          outcome.dropped().size(),
          results);
    } catch (RuntimeException ex) {
      logger.error("resolution cycle failed members={}", group.members().size(), ex);
    } finally {
      metrics.recordResolutionDuration(Duration.between(startedAt, Instant.now(clock)));
      MDC.remove("trace_id");
      MDC.remove("tenant_id");
      MDC.remove("group_key");
    }
    return results;
  }
}
