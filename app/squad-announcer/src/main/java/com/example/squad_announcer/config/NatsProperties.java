/*
 * どこで: Squad 設定バインド
 * 何を: NATS 接続設定をプロパティから読み込む
 * なぜ: 環境ごとの接続先とクライアント名を安全に切り替えるため
 */
package com.example.squad_announcer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nats")
public record NatsProperties(
    boolean enabled, String url, Integer connectionTimeout, String connectionName) {

  public NatsProperties {
    connectionTimeout = connectionTimeout == null ? 5 : connectionTimeout;
    connectionName =
        connectionName == null || connectionName.isBlank() ? "squad-announcer" : connectionName;
  }
}
