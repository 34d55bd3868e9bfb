/*
 * どこで: Squad ドメインモデル
 * 何を: (tenant, user) ごとのプレイセッションのスナップショット
 * なぜ: 状態遷移を不変値の置き換えとして扱い、テナントロック外へ可変状態を漏らさないため
 */
package com.example.squad_announcer.model;

import java.time.Instant;

/** lastSignalAt はこのセッションに最後に適用した信号の受信時刻。放置判定に使う。 */
public record ActivitySession(
    ActivityState state,
    Instant startedAt,
    String voiceChannelId,
    boolean streaming,
    Instant lastSignalAt) {

  public static ActivitySession playing(
      Instant startedAt, String voiceChannelId, boolean streaming) {
    return new ActivitySession(
        ActivityState.PLAYING, startedAt, voiceChannelId, streaming, startedAt);
  }

  public ActivitySession withVoiceChannel(String newVoiceChannelId, Instant signalAt) {
    return new ActivitySession(state, startedAt, newVoiceChannelId, streaming, signalAt);
  }

  public ActivitySession refreshed(
      String newVoiceChannelId, boolean nowStreaming, Instant signalAt) {
    return new ActivitySession(
        state, startedAt, newVoiceChannelId, streaming || nowStreaming, signalAt);
  }

  public ActivitySession pendingResolution(Instant signalAt) {
    return new ActivitySession(
        ActivityState.PENDING_RESOLUTION, startedAt, voiceChannelId, streaming, signalAt);
  }
}
