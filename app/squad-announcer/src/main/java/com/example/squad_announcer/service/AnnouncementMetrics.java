/*
 * どこで: Squad サービス層
 * 何を: 信号処理/グループ確定/取得試行/脱落理由/告知結果のメトリクスを記録する
 * なぜ: 告知漏れや外部 API の劣化を Prometheus から直接観測できるようにするため
 */
package com.example.squad_announcer.service;

import com.example.squad_announcer.model.DropReason;
import com.example.squad_announcer.model.PublishResult;
import com.example.squad_announcer.model.SignalKind;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class AnnouncementMetrics {

  static final String METRIC_SIGNAL_TOTAL = "squad.signal.total";
  static final String METRIC_GROUP_FINALIZED_TOTAL = "squad.group.finalized.total";
  static final String METRIC_GROUP_PENDING_CURRENT = "squad.group.pending.current";
  static final String METRIC_SESSION_ACTIVE_CURRENT = "squad.session.active.current";
  static final String METRIC_FETCH_ATTEMPT_TOTAL = "squad.fetch.attempt.total";
  static final String METRIC_RESOLUTION_DURATION = "squad.resolution.duration";
  static final String METRIC_MEMBER_DROPPED_TOTAL = "squad.member.dropped.total";
  static final String METRIC_ANNOUNCEMENT_TOTAL = "squad.announcement.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger pendingGroups = new AtomicInteger(0);
  private final AtomicInteger activeSessions = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Counter groupFinalizedCounter;
  private final Timer resolutionTimer;

  public AnnouncementMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_GROUP_PENDING_CURRENT, pendingGroups, AtomicInteger::get)
        .description("Current number of pending squad groups awaiting their window")
        .register(meterRegistry);
    Gauge.builder(METRIC_SESSION_ACTIVE_CURRENT, activeSessions, AtomicInteger::get)
        .description("Current number of tracked activity sessions")
        .register(meterRegistry);
    this.groupFinalizedCounter =
        Counter.builder(METRIC_GROUP_FINALIZED_TOTAL)
            .description("Total number of squad groups handed to resolution")
            .register(meterRegistry);
    this.resolutionTimer =
        Timer.builder(METRIC_RESOLUTION_DURATION)
            .description("Duration of one resolution cycle including the API settle wait")
            .register(meterRegistry);
  }

  public void recordSignal(SignalKind kind, String result) {
    counter(
            METRIC_SIGNAL_TOTAL,
            "Activity signals processed by outcome",
            Tags.of("kind", kind.name().toLowerCase(Locale.ROOT), "result", result))
        .increment();
  }

  public void recordGroupFinalized() {
    groupFinalizedCounter.increment();
  }

  public void updatePendingGroups(int count) {
    pendingGroups.set(Math.max(count, 0));
  }

  public void updateActiveSessions(int count) {
    activeSessions.set(Math.max(count, 0));
  }

  public void recordFetchAttempt(String outcome) {
    counter(
            METRIC_FETCH_ATTEMPT_TOTAL,
            "Match provider requests by outcome",
            Tags.of("outcome", outcome))
        .increment();
  }

  public void recordResolutionDuration(Duration duration) {
    if (duration == null || duration.isNegative()) {
      return;
    }
    resolutionTimer.record(duration);
  }

  public void recordDropped(DropReason reason) {
    counter(
            METRIC_MEMBER_DROPPED_TOTAL,
            "Members dropped from resolution by reason",
            Tags.of("reason", reason.value()))
        .increment();
  }

  public void recordAnnouncement(PublishResult result) {
    counter(
            METRIC_ANNOUNCEMENT_TOTAL,
            "Announcement publish outcomes",
            Tags.of("result", result.value()))
        .increment();
  }

  private Counter counter(String name, String description, Tags tags) {
    return counters.computeIfAbsent(
        name + tags,
        ignored ->
            Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}
