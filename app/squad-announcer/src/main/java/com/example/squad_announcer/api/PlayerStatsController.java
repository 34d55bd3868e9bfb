/*
 * どこで: Squad API
 * 何を: 直近成績と直近試合の照会エンドポイントを公開する
 * なぜ: 登録ユーザーが告知を待たずに成績を確認できるようにするため
 */
package com.example.squad_announcer.api;

import com.example.squad_announcer.api.response.LastMatchResponse;
import com.example.squad_announcer.api.response.RecentStatsResponse;
import com.example.squad_announcer.service.PlayerStatsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/tenants/{tenantId}/users/{userId}")
@RequiredArgsConstructor
public class PlayerStatsController {

  private final PlayerStatsService playerStatsService;

  @GetMapping("/stats")
  public ResponseEntity<RecentStatsResponse> recentStats(
      @PathVariable("tenantId") String tenantId, @PathVariable("userId") String userId) {
    return ResponseEntity.ok(playerStatsService.recentStats(tenantId, userId));
  }

  @GetMapping("/last-match")
  public ResponseEntity<LastMatchResponse> lastMatch(
      @PathVariable("tenantId") String tenantId, @PathVariable("userId") String userId) {
    return ResponseEntity.ok(playerStatsService.lastMatch(tenantId, userId));
  }
}
