/*
 * どこで: Squad 下流 DTO
 * 何を: Discord Create DM API のリクエストを表現する
 * なぜ: メンバー個別の DM チャンネルを開くため
 */
package com.example.squad_announcer.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DiscordDmChannelRequest(String recipientId) {}
