/*
 * どこで: Squad NATS 購読
 * 何を: presence 活動信号を JetStream から購読しハンドラへ渡す
 * なぜ: ゲーム開始/終了とボイス移動を少なくとも 1 回は状態機械へ届けるため
 */
package com.example.squad_announcer.nats;

import com.example.common.event.ActivitySignalPayload;
import com.example.squad_announcer.config.PresenceNatsProperties;
import com.example.squad_announcer.service.ActivitySignalHandler;
import com.example.squad_announcer.service.PresenceEventPermanentException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class PresenceEventSubscriber {

  private static final Logger logger = LoggerFactory.getLogger(PresenceEventSubscriber.class);
  private static final int STREAM_NOT_FOUND_ERROR = 404;
  private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

  private final Connection connection;
  private final ActivitySignalHandler signalHandler;
  private final PresenceNatsProperties properties;
  private final ObjectMapper objectMapper;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private Dispatcher dispatcher;
  private JetStreamSubscription subscription;

  public PresenceEventSubscriber(
      Connection connection,
      ActivitySignalHandler signalHandler,
      PresenceNatsProperties properties,
      ObjectMapper objectMapper) {
    this.connection = connection;
    this.signalHandler = signalHandler;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @PostConstruct
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    try {
      ensureStream();
      final JetStream jetStream = connection.jetStream();
      // 単一 Dispatcher で受けて同一ユーザーの信号順序を保つ
      dispatcher = connection.createDispatcher();
      subscription =
          jetStream.subscribe(
              properties.subject(),
              dispatcher,
              this::handleMessage,
              false,
              buildPushSubscribeOptions());
      logger.info(
          "presence subscriber started subject={} stream={} durable={}",
          properties.subject(),
          properties.stream(),
          properties.durable());
    } catch (IOException | JetStreamApiException ex) {
      started.set(false);
      throw new IllegalStateException("failed to start JetStream subscription", ex);
    }
  }

  @PreDestroy
  public void stop() {
    if (subscription != null) {
      subscription.unsubscribe();
      subscription = null;
    }
    if (dispatcher != null) {
      connection.closeDispatcher(dispatcher);
      dispatcher = null;
    }
  }

  @VisibleForTesting
  void handleMessage(Message message) {
    try {
      final ActivitySignalPayload payload =
          objectMapper.readValue(message.getData(), ActivitySignalPayload.class);
      signalHandler.handle(payload);
      message.ack();
    } catch (JsonProcessingException ex) {
      // payload 破損は再配信で回復しないため恒久的に TERM する
      logger.warn("failed to parse presence message payload", ex);
      termSilently(message);
    } catch (IOException ex) {
      logger.warn("failed to read presence message payload", ex);
      termSilently(message);
    } catch (PresenceEventPermanentException ex) {
      logger.warn("permanent failure while handling presence message", ex);
      termSilently(message);
    } catch (DataAccessException ex) {
      // 登録照会の DB 失敗は再配信させる
      logger.warn("temporary failure while handling presence message", ex);
      nakSilently(message);
    } catch (RuntimeException ex) {
      logger.warn("failed to handle presence message", ex);
      nakSilently(message);
    }
  }

  private void ensureStream() throws IOException, JetStreamApiException {
    final StreamConfiguration streamConfiguration =
        StreamConfiguration.builder()
            .name(properties.stream())
            .subjects(properties.subject())
            .duplicateWindow(properties.duplicateWindow())
            .build();
    final JetStreamManagement jetStreamManagement = connection.jetStreamManagement();
    try {
      jetStreamManagement.updateStream(streamConfiguration);
    } catch (JetStreamApiException ex) {
      if (ex.getApiErrorCode() != STREAM_NOT_FOUND_API_ERROR
          && ex.getErrorCode() != STREAM_NOT_FOUND_ERROR) {
        throw ex;
      }
      jetStreamManagement.addStream(streamConfiguration);
    }
    logger.info(
        "presence stream ensured stream={} subject={} duplicateWindow={}",
        properties.stream(),
        properties.subject(),
        properties.duplicateWindow());
  }

  private PushSubscribeOptions buildPushSubscribeOptions() {
    final ConsumerConfiguration consumerConfiguration =
        ConsumerConfiguration.builder()
            .ackPolicy(AckPolicy.Explicit)
            .ackWait(properties.ackWait())
            .maxDeliver(properties.maxDeliver())
            // 未 ack を 1 件に絞り、nak 再配信でも順序を崩さない
            .maxAckPending(1)
            .build();
    return PushSubscribeOptions.builder()
        .stream(properties.stream())
        .durable(properties.durable())
        .configuration(consumerConfiguration)
        .build();
  }

  private void nakSilently(Message message) {
    try {
      message.nak();
    } catch (IllegalStateException ex) {
      logger.warn("failed to nack presence message", ex);
    }
  }

  private void termSilently(Message message) {
    try {
      message.term();
    } catch (IllegalStateException ex) {
      logger.warn("failed to term presence message", ex);
    }
  }
}
