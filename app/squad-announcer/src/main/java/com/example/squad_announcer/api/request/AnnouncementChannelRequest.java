/*
 * どこで: Squad API リクエスト DTO
 * 何を: 告知チャンネル設定 API の入力を定義する
 * なぜ: 受信 JSON を型安全に取り扱うため
 */
package com.example.squad_announcer.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AnnouncementChannelRequest(@NotBlank @Size(max = 64) String channelId) {}
