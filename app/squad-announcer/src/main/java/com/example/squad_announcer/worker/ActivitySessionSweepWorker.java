/*
 * どこで: Squad 定期ワーカー
 * 何を: 終了信号を取りこぼした古い PLAYING セッションを破棄し、ゲージを更新する
 * なぜ: presence 欠落でセッションが残り続けるのを防ぐため
 */
package com.example.squad_announcer.worker;

import com.example.squad_announcer.config.SquadTrackingProperties;
import com.example.squad_announcer.service.ActivityTracker;
import com.example.squad_announcer.service.AnnouncementMetrics;
import com.example.squad_announcer.service.TenantStateStore;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "squad.tracking.sweep-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class ActivitySessionSweepWorker {

  private static final Logger logger = LoggerFactory.getLogger(ActivitySessionSweepWorker.class);

  private final TenantStateStore stateStore;
  private final ActivityTracker activityTracker;
  private final SquadTrackingProperties properties;
  private final AnnouncementMetrics metrics;
  private final Clock clock;

  @Scheduled(fixedDelayString = "${squad.tracking.sweep-interval:PT1M}")
  public void run() {
    final Instant threshold = Instant.now(clock).minus(properties.sessionMaxAge());
    for (String tenantId : stateStore.tenantIds()) {
      try {
        final int evicted = activityTracker.evictStale(tenantId, threshold);
        if (evicted > 0) {
          logger.info("stale sessions evicted tenantId={} count={}", tenantId, evicted);
        }
      } catch (RuntimeException ex) {
        logger.warn("session sweep failed tenantId={}", tenantId, ex);
      }
    }
    metrics.updateActiveSessions(stateStore.totalSessions());
    metrics.updatePendingGroups(stateStore.totalPendingGroups());
  }
}
