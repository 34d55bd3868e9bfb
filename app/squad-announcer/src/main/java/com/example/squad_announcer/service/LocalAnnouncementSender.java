/*
 * どこで: Squad サービス層
 * 何を: 告知配信を模擬する実装
 * なぜ: Discord 無しで集約から台帳更新までの経路を確認するため
 */
package com.example.squad_announcer.service;

import com.example.squad_announcer.model.AnnouncementBatch;
import com.example.squad_announcer.model.AnnouncementMessage;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "discord.enabled", havingValue = "false", matchIfMissing = true)
public class LocalAnnouncementSender implements AnnouncementSender {

  private static final Logger logger = LoggerFactory.getLogger(LocalAnnouncementSender.class);

  private final AnnouncementRenderer renderer;

  @Override
  public void send(AnnouncementBatch batch) {
    final AnnouncementMessage message = renderer.render(batch);
    // 実送信は行わず、ログに残すだけとする
    logger.info(
        "announcement simulated send tenantId={} matchId={} title={} mentions={} footer={}",
        message.tenantId(),
        message.matchId(),
        message.title(),
        message.mentionUserIds(),
        message.footer());
  }
}
