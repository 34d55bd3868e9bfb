/*
 * どこで: Squad サービス層
 * 何を: Riot ID の登録/解除と告知チャンネル設定を扱う
 * なぜ: 追跡対象と告知先をテナント単位で管理するため
 */
package com.example.squad_announcer.service;

import com.example.squad_announcer.api.InvalidSquadRequestException;
import com.example.squad_announcer.api.RegistrationNotFoundException;
import com.example.squad_announcer.api.RiotAccountNotFoundException;
import com.example.squad_announcer.api.request.AnnouncementChannelRequest;
import com.example.squad_announcer.api.request.RegisterRequest;
import com.example.squad_announcer.api.response.AnnouncementChannelResponse;
import com.example.squad_announcer.api.response.RegistrationResponse;
import com.example.squad_announcer.model.Region;
import com.example.squad_announcer.model.Registration;
import com.example.squad_announcer.model.TenantSettings;
import com.example.squad_announcer.repository.RegistrationRepository;
import com.example.squad_announcer.repository.TenantSettingsRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RegistrationService {

  private static final Logger logger = LoggerFactory.getLogger(RegistrationService.class);

  private final RegistrationRepository registrationRepository;
  private final TenantSettingsRepository tenantSettingsRepository;
  private final MatchProviderClient matchProviderClient;
  private final ActivityTracker activityTracker;
  private final Clock clock;

  /**
   * 役割: 提供元でアカウントの実在を確認してから登録する。
   * 動作: region 省略時は na。同じユーザーの再登録は上書き。
   */
  public RegistrationResponse register(String tenantId, String userId, RegisterRequest request) {
    final Region region = parseRegion(request.region());
    final String riotName = request.riotName().trim();
    final String riotTag = request.riotTag().trim();
    if (matchProviderClient.findAccount(riotName, riotTag).isEmpty()) {
      throw new RiotAccountNotFoundException(riotName + "#" + riotTag);
    }
    final Registration registration =
        new Registration(tenantId, userId, riotName, riotTag, region, Instant.now(clock));
    registrationRepository.upsert(registration);
    logger.info(
        "registration saved tenantId={} userId={} region={}", tenantId, userId, region.value());
    return toResponse(registration);
  }

  public void unregister(String tenantId, String userId) {
    if (!registrationRepository.delete(tenantId, userId)) {
      throw new RegistrationNotFoundException(tenantId, userId);
    }
    activityTracker.forget(tenantId, userId);
    logger.info("registration removed tenantId={} userId={}", tenantId, userId);
  }

  public Registration requireRegistration(String tenantId, String userId) {
    return registrationRepository
        .find(tenantId, userId)
        .orElseThrow(() -> new RegistrationNotFoundException(tenantId, userId));
  }

  public AnnouncementChannelResponse setAnnouncementChannel(
      String tenantId, AnnouncementChannelRequest request) {
    final TenantSettings settings =
        new TenantSettings(tenantId, request.channelId().trim(), Instant.now(clock));
    tenantSettingsRepository.upsertAnnouncementChannel(settings);
    logger.info(
        "announcement channel updated tenantId={} channelId={}",
        tenantId,
        settings.announcementChannelId());
    return new AnnouncementChannelResponse(
        settings.tenantId(),
        settings.announcementChannelId(),
        settings.updatedAt().toString());
  }

  private Region parseRegion(String region) {
    if (region == null || region.isBlank()) {
      return Region.NA;
    }
    try {
      return Region.fromValue(region.trim());
    } catch (IllegalArgumentException ex) {
      throw new InvalidSquadRequestException(ex.getMessage());
    }
  }

  private RegistrationResponse toResponse(Registration registration) {
    return new RegistrationResponse(
        registration.tenantId(),
        registration.userId(),
        registration.riotName(),
        registration.riotTag(),
        registration.region().value(),
        registration.registeredAt().toString());
  }
}
