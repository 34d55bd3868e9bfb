/*
 * どこで: Squad 設定
 * 何を: 告知配信先 (Discord REST) の接続設定を保持する
 * なぜ: ボットトークンや DM 送信有無を環境ごとに切り替えるため
 */
package com.example.squad_announcer.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "discord")
public record DiscordProperties(
    boolean enabled,
    String baseUrl,
    String botToken,
    boolean directMessages,
    Duration connectTimeout,
    Duration readTimeout) {

  public DiscordProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://discord.com/api/v10" : baseUrl;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
  }
}
