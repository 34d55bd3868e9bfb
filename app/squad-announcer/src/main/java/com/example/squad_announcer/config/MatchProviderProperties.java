/*
 * どこで: Squad 設定
 * 何を: 試合データ提供元 (HenrikDev 互換 API) の URL/パス/認証設定を保持する
 * なぜ: 提供元の差し替えや API キー投入をコード外で行うため
 */
package com.example.squad_announcer.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "match-provider")
public record MatchProviderProperties(
    String baseUrl,
    String matchHistoryPath,
    String accountPath,
    String apiKey,
    Duration connectTimeout,
    Duration readTimeout) {

  public MatchProviderProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.henrikdev.xyz" : baseUrl;
    matchHistoryPath =
        matchHistoryPath == null || matchHistoryPath.isBlank()
            ? "/valorant/v3/matches/{region}/{name}/{tag}"
            : matchHistoryPath;
    accountPath =
        accountPath == null || accountPath.isBlank()
            ? "/valorant/v1/account/{name}/{tag}"
            : accountPath;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(15) : readTimeout;
  }

  public boolean hasApiKey() {
    return apiKey != null && !apiKey.isBlank();
  }
}
