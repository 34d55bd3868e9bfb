/*
 * どこで: Squad サービス層
 * 何を: 登録ユーザーの直近コンペティティブ成績と直近試合を集計する
 * なぜ: 告知とは独立に本人が成績を照会できるようにするため
 */
package com.example.squad_announcer.service;

import com.example.squad_announcer.api.CompetitiveMatchNotFoundException;
import com.example.squad_announcer.api.response.LastMatchResponse;
import com.example.squad_announcer.api.response.RecentStatsResponse;
import com.example.squad_announcer.model.MatchRecord;
import com.example.squad_announcer.model.PlayerStats;
import com.example.squad_announcer.model.Registration;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PlayerStatsService {

  static final int RECENT_MATCH_LIMIT = 5;

  private final RegistrationService registrationService;
  private final MatchProviderClient matchProviderClient;

  public RecentStatsResponse recentStats(String tenantId, String userId) {
    final Registration registration = registrationService.requireRegistration(tenantId, userId);
    final List<PlayerStats> recent =
        competitiveMatches(registration).stream()
            .limit(RECENT_MATCH_LIMIT)
            .map(match -> match.statsFor(registration.accountKey()))
            .flatMap(Optional::stream)
            .toList();
    if (recent.isEmpty()) {
      throw new CompetitiveMatchNotFoundException(registration.riotId());
    }
    final int matchCount = recent.size();
    final int wins = (int) recent.stream().filter(PlayerStats::won).count();
    final int kills = recent.stream().mapToInt(PlayerStats::kills).sum();
    final int deaths = recent.stream().mapToInt(PlayerStats::deaths).sum();
    final int assists = recent.stream().mapToInt(PlayerStats::assists).sum();
    return new RecentStatsResponse(
        registration.riotId(),
        matchCount,
        wins,
        matchCount - wins,
        kills,
        deaths,
        assists,
        roundOneDecimal((double) kills / matchCount),
        roundOneDecimal((double) deaths / matchCount));
  }

  public LastMatchResponse lastMatch(String tenantId, String userId) {
    final Registration registration = registrationService.requireRegistration(tenantId, userId);
    final MatchRecord match =
        competitiveMatches(registration).stream()
            .findFirst()
            .orElseThrow(() -> new CompetitiveMatchNotFoundException(registration.riotId()));
    final PlayerStats stats =
        match
            .statsFor(registration.accountKey())
            .orElseThrow(() -> new CompetitiveMatchNotFoundException(registration.riotId()));
    final int own = "red".equals(stats.team()) ? match.redRounds() : match.blueRounds();
    final int opponent = "red".equals(stats.team()) ? match.blueRounds() : match.redRounds();
    return new LastMatchResponse(
        match.matchId(),
        stats.won() ? "victory" : "defeat",
        own + "-" + opponent,
        match.map(),
        stats.agent(),
        stats.kills(),
        stats.deaths(),
        stats.assists(),
        match.mode());
  }

  private List<MatchRecord> competitiveMatches(Registration registration) {
    return matchProviderClient
        .recentMatches(registration.region(), registration.riotName(), registration.riotTag())
        .stream()
        .filter(MatchRecord::competitive)
        .toList();
  }

  private double roundOneDecimal(double value) {
    return Math.round(value * 10.0) / 10.0;
  }
}
