/*
 * どこで: Squad インフラ設定
 * 何を: NATS Connection を Spring 管理下に置く
 * なぜ: presence 購読が同一接続を再利用するため
 */
package com.example.squad_announcer.config;

import io.nats.client.Connection;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsConfig {

  @Bean(destroyMethod = "close")
  public Connection natsConnection(NatsProperties properties)
      throws IOException, InterruptedException {
    final Options options =
        new Options.Builder()
            .server(properties.url())
            .connectionTimeout(Duration.ofSeconds(properties.connectionTimeout()))
            .connectionName(properties.connectionName())
            // presence は at-least-once 前提なので切断中も再接続を続ける
            .maxReconnects(-1)
            .build();
    return Nats.connect(options);
  }
}
