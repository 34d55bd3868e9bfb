/*
 * どこで: Squad 設定
 * 何を: 試合データ提供元呼び出し専用の RestClient を提供する
 * なぜ: baseUrl/タイムアウト/API キーを呼び出し側から隠蔽するため
 */
package com.example.squad_announcer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class MatchProviderClientConfig {

  @Bean
  RestClient matchProviderRestClient(
      RestClient.Builder builder, MatchProviderProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    final RestClient.Builder configured =
        builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory);
    if (properties.hasApiKey()) {
      // API キー無しでも動くがレート制限が厳しい (30 req/min)
      configured.defaultHeader(HttpHeaders.AUTHORIZATION, properties.apiKey());
    }
    return configured.build();
  }
}
