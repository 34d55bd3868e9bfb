/*
 * どこで: Squad サービス層テスト
 * 何を: GroupCollector の待機窓 (延長/上限/古い発火/ソロ/テナント分離) を検証する
 * なぜ: 同じ試合を終えた仲間が 1 グループにまとまり、それ以外が混ざらないことを保証するため
 */
package com.example.squad_announcer.service;

import static com.example.squad_announcer.service.SquadFixtures.GROUP_WAIT;
import static com.example.squad_announcer.service.SquadFixtures.MAX_GROUP_WAIT;
import static com.example.squad_announcer.service.SquadFixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;

import com.example.squad_announcer.model.FinalizedGroup;
import com.example.squad_announcer.model.GroupKey;
import com.example.squad_announcer.model.SessionEnded;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GroupCollectorTest {

  private static final String TENANT = "tenant-1";

  private final List<FinalizedGroup> finalized = new ArrayList<>();
  private MutableClock clock;
  private ManualGroupTimer timer;
  private TenantStateStore stateStore;
  private GroupCollector collector;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(T0);
    timer = new ManualGroupTimer();
    stateStore = new TenantStateStore();
    collector =
        new GroupCollector(
            stateStore,
            timer,
            finalized::add,
            SquadFixtures.trackingProperties(),
            new AnnouncementMetrics(new SimpleMeterRegistry()),
            clock);
  }

  @Test
  void membersEndingInSameVoiceChannelAreFinalizedTogether() {
    collector.onSessionEnded(ended(TENANT, "user-a", "v-1"));
    clock.advance(Duration.ofSeconds(10));
    collector.onSessionEnded(ended(TENANT, "user-b", "v-1"));

    clock.advance(Duration.ofSeconds(20));
    timer.fireDue(clock.instant());
    assertThat(finalized).isEmpty();

    clock.advance(Duration.ofSeconds(10));
    timer.fireDue(clock.instant());

    assertThat(finalized).hasSize(1);
    assertThat(finalized.get(0).members())
        .extracting(SessionEnded::userId)
        .containsExactly("user-a", "user-b");
    assertThat(stateStore.totalPendingGroups()).isZero();
  }

  @Test
  void soloMemberIsFinalizedAfterGroupWaitTime() {
    collector.onSessionEnded(ended(TENANT, "user-c", null));

    clock.advance(GROUP_WAIT.minusSeconds(1));
    timer.fireDue(clock.instant());
    assertThat(finalized).isEmpty();

    clock.advance(Duration.ofSeconds(1));
    timer.fireDue(clock.instant());

    assertThat(finalized).hasSize(1);
    assertThat(finalized.get(0).key().channelKey()).isEqualTo("solo:user-c");
    assertThat(finalized.get(0).members())
        .extracting(SessionEnded::userId)
        .containsExactly("user-c");
  }

  @Test
  void membersWithoutVoiceAreNeverMerged() {
    collector.onSessionEnded(ended(TENANT, "user-a", null));
    collector.onSessionEnded(ended(TENANT, "user-b", null));

    clock.advance(GROUP_WAIT);
    timer.fireDue(clock.instant());

    assertThat(finalized).hasSize(2);
    assertThat(finalized).allSatisfy(group -> assertThat(group.members()).hasSize(1));
  }

  @Test
  void windowIsCappedAtMaxGroupWait() {
    final GroupKey key = new GroupKey(TENANT, "voice:v-1");
    collector.onSessionEnded(ended(TENANT, "user-0", "v-1"));
    for (int i = 1; i <= 8; i++) {
      clock.advance(Duration.ofSeconds(20));
      collector.onSessionEnded(ended(TENANT, "user-" + i, "v-1"));
    }

    // T0+160s の到着で now+30s は T0+190s だが上限 T0+180s で止まる
    assertThat(timer.deadlineOf(key)).contains(T0.plus(MAX_GROUP_WAIT));

    clock.advance(Duration.ofSeconds(20));
    timer.fireDue(clock.instant());

    assertThat(finalized).hasSize(1);
    assertThat(finalized.get(0).members()).hasSize(9);
    assertThat(finalized.get(0).finalizedAt()).isEqualTo(T0.plus(MAX_GROUP_WAIT));
  }

  @Test
  void earlyTimerFireIsRescheduledToCurrentDeadline() {
    final GroupKey key = new GroupKey(TENANT, "voice:v-1");
    collector.onSessionEnded(ended(TENANT, "user-a", "v-1"));
    clock.advance(Duration.ofSeconds(20));
    collector.onSessionEnded(ended(TENANT, "user-b", "v-1"));
    clock.advance(Duration.ofSeconds(10));

    // 最初の締切 (T0+30s) で発火した古いタイマー
    collector.onWindowExpired(key);

    assertThat(finalized).isEmpty();
    assertThat(timer.deadlineOf(key)).contains(T0.plusSeconds(50));
  }

  @Test
  void timerForRemovedGroupIsIgnored() {
    collector.onWindowExpired(new GroupKey(TENANT, "voice:unknown"));

    assertThat(finalized).isEmpty();
    assertThat(timer.scheduledCount()).isZero();
  }

  @Test
  void sessionEndingAfterFinalizationStartsNewGroup() {
    collector.onSessionEnded(ended(TENANT, "user-a", "v-1"));
    clock.advance(GROUP_WAIT);
    timer.fireDue(clock.instant());

    collector.onSessionEnded(ended(TENANT, "user-b", "v-1"));
    clock.advance(GROUP_WAIT);
    timer.fireDue(clock.instant());

    assertThat(finalized).hasSize(2);
    assertThat(finalized.get(1).members())
        .extracting(SessionEnded::userId)
        .containsExactly("user-b");
  }

  @Test
  void sameVoiceChannelIdInDifferentTenantsIsNotMerged() {
    collector.onSessionEnded(ended("tenant-1", "user-a", "v-1"));
    collector.onSessionEnded(ended("tenant-2", "user-b", "v-1"));

    clock.advance(GROUP_WAIT);
    timer.fireDue(clock.instant());

    assertThat(finalized)
        .extracting(FinalizedGroup::tenantId)
        .containsExactlyInAnyOrder("tenant-1", "tenant-2");
    assertThat(finalized).allSatisfy(group -> assertThat(group.members()).hasSize(1));
  }

  private SessionEnded ended(String tenantId, String userId, String voiceChannelId) {
    return new SessionEnded(
        tenantId, userId, voiceChannelId, false, T0.minusSeconds(1800), clock.instant());
  }
}
