/*
 * どこで: Squad 下流 DTO
 * 何を: Discord チャンネル応答のうち id だけを表現する
 * なぜ: 開いた DM チャンネルへ続けて送信するため
 */
package com.example.squad_announcer.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DiscordChannelResponse(String id) {}
