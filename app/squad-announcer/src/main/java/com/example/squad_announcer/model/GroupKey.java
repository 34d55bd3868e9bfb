/*
 * どこで: Squad ドメインモデル
 * 何を: PendingGroup とタイマーのキー (tenant + ボイスチャンネル or ソロキー) を表現する
 * なぜ: ボイス未参加のユーザが他人とマージされないことをキーの形で保証するため
 */
package com.example.squad_announcer.model;

public record GroupKey(String tenantId, String channelKey) {

  private static final String VOICE_PREFIX = "voice:";
  private static final String SOLO_PREFIX = "solo:";

  public static GroupKey forSession(SessionEnded event) {
    final String voiceChannelId = event.voiceChannelId();
    if (voiceChannelId != null && !voiceChannelId.isBlank()) {
      return new GroupKey(event.tenantId(), VOICE_PREFIX + voiceChannelId);
    }
    return new GroupKey(event.tenantId(), SOLO_PREFIX + event.userId());
  }

  @Override
  public String toString() {
    return tenantId + "/" + channelKey;
  }
}
