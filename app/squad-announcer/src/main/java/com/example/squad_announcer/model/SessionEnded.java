/*
 * どこで: Squad ドメインモデル
 * 何を: プレイ終了を検知した時点のセッション情報を表現する
 * なぜ: GroupCollector へ渡すグルーピング入力を固定するため
 */
package com.example.squad_announcer.model;

import java.time.Instant;

public record SessionEnded(
    String tenantId,
    String userId,
    String voiceChannelId,
    boolean streaming,
    Instant startedAt,
    Instant endedAt) {}
