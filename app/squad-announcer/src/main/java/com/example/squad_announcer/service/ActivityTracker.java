/*
 * どこで: Squad サービス層
 * 何を: (tenant, user) ごとの活動状態 IDLE / PLAYING / PENDING_RESOLUTION を遷移させる
 * なぜ: 開始/終了信号から 1 プレイ分の終了イベントを 1 回だけ取り出すため
 */
package com.example.squad_announcer.service;

import com.example.squad_announcer.model.ActivitySession;
import com.example.squad_announcer.model.ActivitySignal;
import com.example.squad_announcer.model.ActivityState;
import com.example.squad_announcer.model.SessionEnded;
import com.example.squad_announcer.repository.RegistrationRepository;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ActivityTracker {

  private static final Logger logger = LoggerFactory.getLogger(ActivityTracker.class);

  static final String RESULT_STARTED = "started";
  static final String RESULT_REFRESHED = "refreshed";
  static final String RESULT_ENDED = "ended";
  static final String RESULT_VOICE_UPDATED = "voice_updated";
  static final String RESULT_IGNORED = "ignored";
  static final String RESULT_UNREGISTERED = "unregistered";

  private final TenantStateStore stateStore;
  private final RegistrationRepository registrationRepository;
  private final AnnouncementMetrics metrics;

  /**
   * 役割: 1 件の活動信号を状態機械へ適用する。
   * 動作: PLAYING 中の STOPPED だけが PENDING_RESOLUTION へ遷移し SessionEnded を返す。
   *       未登録ユーザーの信号と、その状態で意味を持たない信号は無視する。
   * 前提: 同一ユーザーの信号は到着順に呼ばれること。
   */
  public Optional<SessionEnded> onActivitySignal(ActivitySignal signal) {
    if (!registrationRepository.exists(signal.tenantId(), signal.userId())) {
      metrics.recordSignal(signal.kind(), RESULT_UNREGISTERED);
      return Optional.empty();
    }
    final Transition transition =
        stateStore.withTenant(
            signal.tenantId(),
            partition -> {
              final Optional<ActivitySession> current = partition.session(signal.userId());
              return switch (signal.kind()) {
                case STARTED -> start(partition, current, signal);
                case STOPPED -> stop(partition, current, signal);
                case VOICE_CHANGED -> changeVoice(partition, current, signal);
              };
            });
    metrics.recordSignal(signal.kind(), transition.result());
    logger.debug(
        "activity signal applied tenantId={} userId={} kind={} result={}",
        signal.tenantId(),
        signal.userId(),
        signal.kind(),
        transition.result());
    return Optional.ofNullable(transition.ended());
  }

  /** 解決の成否にかかわらず、指定ユーザーの PENDING_RESOLUTION を IDLE へ戻す。 */
  public void release(String tenantId, Collection<String> userIds) {
    stateStore.withTenant(
        tenantId,
        partition -> {
          for (String userId : userIds) {
            partition
                .session(userId)
                .filter(session -> session.state() == ActivityState.PENDING_RESOLUTION)
                .ifPresent(session -> partition.removeSession(userId));
          }
          return null;
        });
  }

  /** 登録解除時に呼ぶ。解決中のセッションは解決側が戻すので触らない。 */
  public void forget(String tenantId, String userId) {
    stateStore.withTenant(
        tenantId,
        partition -> {
          partition
              .session(userId)
              .filter(session -> session.state() == ActivityState.PLAYING)
              .ifPresent(session -> partition.removeSession(userId));
          return null;
        });
  }

  public ActivityState stateOf(String tenantId, String userId) {
    return stateStore.withTenant(
        tenantId,
        partition ->
            partition.session(userId).map(ActivitySession::state).orElse(ActivityState.IDLE));
  }

  /**
   * 役割: 最後の信号が threshold より古い PLAYING セッションを破棄する。
   * 動作: 終了信号を取りこぼしたセッションが残り続けないようにする。開始や移動の信号が
   *       届き続けている長時間セッションは残す。
   */
  public int evictStale(String tenantId, Instant threshold) {
    return stateStore.withTenant(
        tenantId,
        partition -> {
          int evicted = 0;
          for (var entry : partition.sessionsSnapshot().entrySet()) {
            final ActivitySession session = entry.getValue();
            if (session.state() == ActivityState.PLAYING
                && session.lastSignalAt().isBefore(threshold)) {
              partition.removeSession(entry.getKey());
              evicted++;
            }
          }
          return evicted;
        });
  }

  private Transition start(
      TenantStateStore.TenantPartition partition,
      Optional<ActivitySession> current,
      ActivitySignal signal) {
    if (current.isEmpty()) {
      partition.putSession(
          signal.userId(),
          ActivitySession.playing(
              signal.receivedAt(), signal.voiceChannelId(), signal.streaming()));
      return new Transition(RESULT_STARTED, null);
    }
    final ActivitySession session = current.get();
    if (session.state() == ActivityState.PLAYING) {
      partition.putSession(
          signal.userId(),
          session.refreshed(signal.voiceChannelId(), signal.streaming(), signal.receivedAt()));
      return new Transition(RESULT_REFRESHED, null);
    }
    // 解決中のセッションは解決が所有している
    return new Transition(RESULT_IGNORED, null);
  }

  private Transition stop(
      TenantStateStore.TenantPartition partition,
      Optional<ActivitySession> current,
      ActivitySignal signal) {
    if (current.isEmpty() || current.get().state() != ActivityState.PLAYING) {
      return new Transition(RESULT_IGNORED, null);
    }
    ActivitySession session = current.get();
    if (signal.voiceChannelId() != null && !signal.voiceChannelId().isBlank()) {
      session = session.withVoiceChannel(signal.voiceChannelId(), signal.receivedAt());
    }
    final ActivitySession pending = session.pendingResolution(signal.receivedAt());
    partition.putSession(signal.userId(), pending);
    final SessionEnded ended =
        new SessionEnded(
            signal.tenantId(),
            signal.userId(),
            pending.voiceChannelId(),
            pending.streaming(),
            pending.startedAt(),
            signal.receivedAt());
    return new Transition(RESULT_ENDED, ended);
  }

  private Transition changeVoice(
      TenantStateStore.TenantPartition partition,
      Optional<ActivitySession> current,
      ActivitySignal signal) {
    if (current.isEmpty() || current.get().state() != ActivityState.PLAYING) {
      return new Transition(RESULT_IGNORED, null);
    }
    partition.putSession(
        signal.userId(),
        current.get().withVoiceChannel(signal.voiceChannelId(), signal.receivedAt()));
    return new Transition(RESULT_VOICE_UPDATED, null);
  }

  private record Transition(String result, SessionEnded ended) {}
}
