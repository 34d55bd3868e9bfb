/*
 * どこで: Squad API
 * 何を: 登録/解除と告知チャンネル設定のエンドポイントを公開する
 * なぜ: テナント (サーバー) ごとの追跡対象と告知先を操作する入口を提供するため
 */
package com.example.squad_announcer.api;

import com.example.squad_announcer.api.request.AnnouncementChannelRequest;
import com.example.squad_announcer.api.request.RegisterRequest;
import com.example.squad_announcer.api.response.AnnouncementChannelResponse;
import com.example.squad_announcer.api.response.RegistrationResponse;
import com.example.squad_announcer.service.RegistrationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/tenants/{tenantId}")
@RequiredArgsConstructor
public class RegistrationController {

  private final RegistrationService registrationService;

  @PutMapping("/registrations/{userId}")
  public ResponseEntity<RegistrationResponse> register(
      @PathVariable("tenantId") String tenantId,
      @PathVariable("userId") String userId,
      @Valid @RequestBody RegisterRequest request) {
    return ResponseEntity.ok(registrationService.register(tenantId, userId, request));
  }

  @DeleteMapping("/registrations/{userId}")
  public ResponseEntity<Void> unregister(
      @PathVariable("tenantId") String tenantId, @PathVariable("userId") String userId) {
    registrationService.unregister(tenantId, userId);
    return ResponseEntity.noContent().build();
  }

  @PutMapping("/announcement-channel")
  public ResponseEntity<AnnouncementChannelResponse> setAnnouncementChannel(
      @PathVariable("tenantId") String tenantId,
      @Valid @RequestBody AnnouncementChannelRequest request) {
    return ResponseEntity.ok(registrationService.setAnnouncementChannel(tenantId, request));
  }
}
