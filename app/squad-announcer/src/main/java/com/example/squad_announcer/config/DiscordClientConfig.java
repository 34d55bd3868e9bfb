/*
 * どこで: Squad 設定
 * 何を: Discord REST 呼び出し専用の RestClient を提供する
 * なぜ: Bot 認証ヘッダーとタイムアウトを Sender から分離するため
 */
package com.example.squad_announcer.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@ConditionalOnProperty(name = "discord.enabled", havingValue = "true")
public class DiscordClientConfig {

  @Bean
  RestClient discordRestClient(RestClient.Builder builder, DiscordProperties properties) {
    if (properties.botToken() == null || properties.botToken().isBlank()) {
      throw new IllegalStateException("discord.bot-token is required when discord.enabled=true");
    }
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory)
        .defaultHeader(HttpHeaders.AUTHORIZATION, "Bot " + properties.botToken())
        .build();
  }
}
