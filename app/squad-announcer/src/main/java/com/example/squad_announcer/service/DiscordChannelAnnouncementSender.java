/*
 * どこで: Squad サービス層
 * 何を: 告知を Discord の告知チャンネルと各メンバーの DM へ送信する
 * なぜ: テナントごとの告知先へ 1 試合 1 件の告知を届けるため
 */
package com.example.squad_announcer.service;

import com.example.squad_announcer.config.DiscordProperties;
import com.example.squad_announcer.model.AnnouncementBatch;
import com.example.squad_announcer.model.AnnouncementMessage;
import com.example.squad_announcer.model.TenantSettings;
import com.example.squad_announcer.repository.TenantSettingsRepository;
import com.example.squad_announcer.service.dto.DiscordChannelResponse;
import com.example.squad_announcer.service.dto.DiscordDmChannelRequest;
import com.example.squad_announcer.service.dto.DiscordMessageRequest;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Component
@ConditionalOnProperty(name = "discord.enabled", havingValue = "true")
public class DiscordChannelAnnouncementSender implements AnnouncementSender {

  private static final Logger logger =
      LoggerFactory.getLogger(DiscordChannelAnnouncementSender.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RestClient discordRestClient;

  private final DiscordProperties properties;
  private final TenantSettingsRepository tenantSettingsRepository;
  private final AnnouncementRenderer renderer;

  public DiscordChannelAnnouncementSender(
      @Qualifier("discordRestClient") RestClient discordRestClient,
      DiscordProperties properties,
      TenantSettingsRepository tenantSettingsRepository,
      AnnouncementRenderer renderer) {
    this.discordRestClient = discordRestClient;
    this.properties = properties;
    this.tenantSettingsRepository = tenantSettingsRepository;
    this.renderer = renderer;
  }

  /**
   * 役割: 告知チャンネルへメンション付きで投稿し、設定に応じて各メンバーへ DM する。
   * 動作: チャンネル投稿の失敗は例外。DM は個別に失敗を許容する。
   *       告知チャンネル未設定のテナントは DM のみで、1 通も届かなければ失敗とする。
   */
  @Override
  public void send(AnnouncementBatch batch) {
    final AnnouncementMessage message = renderer.render(batch);
    final DiscordMessageRequest.Embed embed = toEmbed(message);
    final Optional<String> channelId =
        tenantSettingsRepository
            .find(batch.tenantId())
            .map(TenantSettings::announcementChannelId)
            .filter(id -> !id.isBlank());
    if (channelId.isEmpty() && !properties.directMessages()) {
      throw new AnnouncementDeliveryException(
          AnnouncementDeliveryException.Reason.NO_TARGET,
          "no announcement channel configured for tenant " + batch.tenantId());
    }
    channelId.ifPresent(id -> postToChannel(id, message, embed));

    int directMessagesDelivered = 0;
    if (properties.directMessages()) {
      for (String userId : message.mentionUserIds()) {
        if (sendDirectMessage(userId, embed)) {
          directMessagesDelivered++;
        }
      }
    }
    if (channelId.isEmpty() && directMessagesDelivered == 0) {
      throw new AnnouncementDeliveryException(
          AnnouncementDeliveryException.Reason.NO_TARGET,
          "no direct message could be delivered for tenant " + batch.tenantId());
    }
    logger.info(
        "announcement delivered tenantId={} matchId={} channel={} directMessages={}",
        batch.tenantId(),
        batch.matchId(),
        channelId.orElse("-"),
        directMessagesDelivered);
  }

  private void postToChannel(
      String channelId, AnnouncementMessage message, DiscordMessageRequest.Embed embed) {
    final String mentions =
        message.mentionUserIds().stream()
            .map(userId -> "<@" + userId + ">")
            .collect(Collectors.joining(" "));
    final DiscordMessageRequest request =
        new DiscordMessageRequest(
            mentions,
            List.of(embed),
            new DiscordMessageRequest.AllowedMentions(message.mentionUserIds()));
    try {
      discordRestClient
          .post()
          .uri("/channels/{channelId}/messages", channelId)
          .body(request)
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, "postToChannel");
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, "postToChannel");
    }
  }

  private boolean sendDirectMessage(String userId, DiscordMessageRequest.Embed embed) {
    try {
      final DiscordChannelResponse dmChannel =
          discordRestClient
              .post()
              .uri("/users/@me/channels")
              .body(new DiscordDmChannelRequest(userId))
              .retrieve()
              .body(DiscordChannelResponse.class);
      if (dmChannel == null || dmChannel.id() == null) {
        logger.warn("discord dm channel response is invalid userId={}", userId);
        return false;
      }
      discordRestClient
          .post()
          .uri("/channels/{channelId}/messages", dmChannel.id())
          .body(new DiscordMessageRequest(null, List.of(embed), null))
          .retrieve()
          .toBodilessEntity();
      return true;
    } catch (RestClientResponseException ex) {
      if (ex.getStatusCode().value() == 403) {
        // DM を閉じているメンバーは対象外
        logger.info("discord dm refused userId={}", userId);
        return false;
      }
      logger.warn(
          "discord dm failed userId={} status={}", userId, ex.getStatusCode().value(), ex);
      return false;
    } catch (ResourceAccessException ex) {
      logger.warn("discord dm connection failed userId={}", userId, ex);
      return false;
    }
  }

  private DiscordMessageRequest.Embed toEmbed(AnnouncementMessage message) {
    return new DiscordMessageRequest.Embed(
        message.title(),
        message.color(),
        message.fields().stream()
            .map(
                field ->
                    new DiscordMessageRequest.EmbedField(
                        field.name(), field.value(), field.inline()))
            .toList(),
        new DiscordMessageRequest.Footer(message.footer()),
        message.timestamp().toString());
  }

  private AnnouncementDeliveryException mapResponseException(
      RestClientResponseException ex, String operation) {
    final int status = ex.getStatusCode().value();
    logger.warn(
        "discord {} failed with http status={} statusText={}",
        operation,
        status,
        ex.getStatusText());
    if (status == 403 || status == 404) {
      return new AnnouncementDeliveryException(
          AnnouncementDeliveryException.Reason.FORBIDDEN, "discord denied channel access", ex);
    }
    if (status == 429) {
      return new AnnouncementDeliveryException(
          AnnouncementDeliveryException.Reason.RATE_LIMITED, "discord rate limited", ex);
    }
    return new AnnouncementDeliveryException(
        AnnouncementDeliveryException.Reason.UPSTREAM_ERROR, "discord request failed", ex);
  }

  private AnnouncementDeliveryException mapResourceException(
      ResourceAccessException ex, String operation) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        logger.warn("discord {} timed out", operation);
        return new AnnouncementDeliveryException(
            AnnouncementDeliveryException.Reason.TIMEOUT, "discord request timeout", ex);
      }
      current = current.getCause();
    }
    logger.warn("discord {} connection failed", operation, ex);
    return new AnnouncementDeliveryException(
        AnnouncementDeliveryException.Reason.UPSTREAM_ERROR, "discord connection failed", ex);
  }
}
