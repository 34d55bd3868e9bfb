/*
 * どこで: common のイベント payload 定義
 * 何を: presence 収集側から届くアクティビティ信号の JSON 形状を定義する
 * なぜ: 送信側と squad-announcer で同一のペイロード形状を共有するため
 */
package com.example.common.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ActivitySignalPayload(
    String eventId,
    String tenantId,
    String userId,
    String kind,
    String voiceChannelId,
    boolean streaming,
    String occurredAt) {}
