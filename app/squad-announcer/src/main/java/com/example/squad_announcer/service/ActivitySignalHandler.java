/*
 * どこで: Squad サービス層
 * 何を: presence イベントを検証し、状態機械とグループ収集へ流す
 * なぜ: 購読経路から信号処理を分離し、恒久的失敗を明示するため
 */
package com.example.squad_announcer.service;

import com.example.common.event.ActivitySignalPayload;
import com.example.squad_announcer.model.ActivitySignal;
import com.example.squad_announcer.model.SessionEnded;
import com.example.squad_announcer.model.SignalKind;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ActivitySignalHandler {

  private final ActivityTracker activityTracker;
  private final GroupCollector groupCollector;
  private final Clock clock;

  public void handle(ActivitySignalPayload payload) {
    final ActivitySignal signal = toSignal(payload);
    MDC.put("tenant_id", signal.tenantId());
    MDC.put("user_id", signal.userId());
    try {
      final Optional<SessionEnded> ended = activityTracker.onActivitySignal(signal);
      ended.ifPresent(groupCollector::onSessionEnded);
    } finally {
      MDC.remove("tenant_id");
      MDC.remove("user_id");
    }
  }

  private ActivitySignal toSignal(ActivitySignalPayload payload) {
    if (payload == null) {
      throw new PresenceEventPermanentException("presence payload is empty");
    }
    if (isBlank(payload.tenantId()) || isBlank(payload.userId())) {
      throw new PresenceEventPermanentException("presence tenant_id and user_id are required");
    }
    final SignalKind kind;
    try {
      kind = SignalKind.fromValue(payload.kind());
    } catch (IllegalArgumentException ex) {
      throw new PresenceEventPermanentException("invalid presence kind", ex);
    }
    return new ActivitySignal(
        payload.tenantId(),
        payload.userId(),
        kind,
        isBlank(payload.voiceChannelId()) ? null : payload.voiceChannelId(),
        payload.streaming(),
        parseOccurredAt(payload.occurredAt()));
  }

  private Instant parseOccurredAt(String occurredAt) {
    if (isBlank(occurredAt)) {
      return Instant.now(clock);
    }
    try {
      return Instant.parse(occurredAt);
    } catch (RuntimeException ex) {
      throw new PresenceEventPermanentException("invalid presence occurred_at", ex);
    }
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
