/*
 * どこで: Squad 定期ワーカーテスト
 * 何を: 古い PLAYING セッションの破棄とゲージ更新を検証する
 * なぜ: 終了信号を取りこぼしたセッションが残り続けないことを保証するため
 */
package com.example.squad_announcer.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;

import com.example.squad_announcer.config.SquadTrackingProperties;
import com.example.squad_announcer.model.ActivitySignal;
import com.example.squad_announcer.model.ActivityState;
import com.example.squad_announcer.model.SignalKind;
import com.example.squad_announcer.repository.RegistrationRepository;
import com.example.squad_announcer.service.ActivityTracker;
import com.example.squad_announcer.service.AnnouncementMetrics;
import com.example.squad_announcer.service.TenantStateStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ActivitySessionSweepWorkerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T18:00:00Z");

  @Mock private RegistrationRepository registrationRepository;

  private SimpleMeterRegistry meterRegistry;
  private TenantStateStore stateStore;
  private ActivityTracker tracker;
  private ActivitySessionSweepWorker worker;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    stateStore = new TenantStateStore();
    final AnnouncementMetrics metrics = new AnnouncementMetrics(meterRegistry);
    tracker = new ActivityTracker(stateStore, registrationRepository, metrics);
    final SquadTrackingProperties properties =
        new SquadTrackingProperties(
            Duration.ofSeconds(30),
            Duration.ofMinutes(3),
            Duration.ofSeconds(60),
            true,
            Duration.ofSeconds(20),
            Duration.ofHours(6),
            2,
            1);
    worker =
        new ActivitySessionSweepWorker(
            stateStore, tracker, properties, metrics, Clock.fixed(NOW, ZoneOffset.UTC));
    lenient().when(registrationRepository.exists(anyString(), anyString())).thenReturn(true);
  }

  @Test
  void runEvictsSessionsOlderThanMaxAgeAcrossTenants() {
    start("tenant-1", "user-old", NOW.minus(Duration.ofHours(7)));
    start("tenant-1", "user-new", NOW.minus(Duration.ofHours(1)));
    start("tenant-2", "user-old", NOW.minus(Duration.ofHours(8)));

    worker.run();

    assertThat(tracker.stateOf("tenant-1", "user-old")).isEqualTo(ActivityState.IDLE);
    assertThat(tracker.stateOf("tenant-1", "user-new")).isEqualTo(ActivityState.PLAYING);
    assertThat(tracker.stateOf("tenant-2", "user-old")).isEqualTo(ActivityState.IDLE);
    assertThat(meterRegistry.get("squad.session.active.current").gauge().value())
        .isEqualTo(1.0);
  }

  private void start(String tenantId, String userId, Instant at) {
    tracker.onActivitySignal(
        new ActivitySignal(tenantId, userId, SignalKind.STARTED, null, false, at));
  }
}
