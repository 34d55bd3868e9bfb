/*
 * どこで: Squad ドメインモデル
 * 何を: 1 ユーザのアクティビティ開始/終了/ボイス移動信号を表現する
 * なぜ: NATS payload から切り離した内部入力として ActivityTracker に渡すため
 */
package com.example.squad_announcer.model;

import java.time.Instant;

public record ActivitySignal(
    String tenantId,
    String userId,
    SignalKind kind,
    String voiceChannelId,
    boolean streaming,
    Instant receivedAt) {}
