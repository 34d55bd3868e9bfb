/*
 * どこで: Squad API
 * 何を: テナントの追跡状態を返すデバッグ用エンドポイント
 * なぜ: 待機グループやセッションの滞留を運用で確認するため
 */
package com.example.squad_announcer.api;

import com.example.squad_announcer.api.response.TrackingStatusResponse;
import com.example.squad_announcer.service.TrackingStatusService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class TrackingDebugController {

  private final TrackingStatusService trackingStatusService;

  @GetMapping("/v1/tenants/{tenantId}/tracking")
  public ResponseEntity<TrackingStatusResponse> tracking(
      @PathVariable("tenantId") String tenantId) {
    return ResponseEntity.ok(trackingStatusService.snapshot(tenantId));
  }
}
