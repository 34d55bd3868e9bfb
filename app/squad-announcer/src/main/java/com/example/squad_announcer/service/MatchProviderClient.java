/*
 * どこで: Squad サービス層
 * 何を: 試合データ提供元 (HenrikDev 互換 API) から試合履歴/アカウントを取得する
 * なぜ: HTTP 失敗を MatchProviderException へ変換し、取得側のリトライ判断を単純にするため
 */
package com.example.squad_announcer.service;

import com.example.squad_announcer.config.MatchProviderProperties;
import com.example.squad_announcer.model.MatchRecord;
import com.example.squad_announcer.model.PlayerStats;
import com.example.squad_announcer.model.Region;
import com.example.squad_announcer.model.RiotAccount;
import com.example.squad_announcer.service.dto.HenrikAccountResponse;
import com.example.squad_announcer.service.dto.HenrikMatchesResponse;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class MatchProviderClient {

  private static final Logger logger = LoggerFactory.getLogger(MatchProviderClient.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RestClient matchProviderRestClient;

  private final MatchProviderProperties properties;

  public MatchProviderClient(
      @Qualifier("matchProviderRestClient") RestClient matchProviderRestClient,
      MatchProviderProperties properties) {
    this.matchProviderRestClient = matchProviderRestClient;
    this.properties = properties;
  }

  /** 新しい順の試合履歴。履歴が空なら空リストを返す。 */
  public List<MatchRecord> recentMatches(Region region, String riotName, String riotTag) {
    validateRiotId(riotName, riotTag);
    final HenrikMatchesResponse response;
    try {
      response =
          matchProviderRestClient
              .get()
              .uri(properties.matchHistoryPath(), region.value(), riotName, riotTag)
              .retrieve()
              .body(HenrikMatchesResponse.class);
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, "recentMatches");
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, "recentMatches");
    } catch (RuntimeException ex) {
      logger.warn("match provider recentMatches response parse failed", ex);
      throw new MatchProviderException(
          MatchProviderException.Reason.INVALID_RESPONSE, "match provider response parse failed", ex);
    }
    if (response == null) {
      throw new MatchProviderException(
          MatchProviderException.Reason.INVALID_RESPONSE, "match provider response is empty");
    }
    return response.data().stream().map(this::toMatchRecord).toList();
  }

  public Optional<MatchRecord> lastMatch(Region region, String riotName, String riotTag) {
    return recentMatches(region, riotName, riotTag).stream().findFirst();
  }

  /** アカウントが存在しなければ空を返す。それ以外の失敗は例外。 */
  public Optional<RiotAccount> findAccount(String riotName, String riotTag) {
    validateRiotId(riotName, riotTag);
    try {
      final HenrikAccountResponse response =
          matchProviderRestClient
              .get()
              .uri(properties.accountPath(), riotName, riotTag)
              .retrieve()
              .body(HenrikAccountResponse.class);
      if (response == null || response.data() == null) {
        return Optional.empty();
      }
      final HenrikAccountResponse.Account account = response.data();
      return Optional.of(
          new RiotAccount(
              account.name(),
              account.tag(),
              account.region(),
              account.accountLevel() == null ? 0 : account.accountLevel()));
    } catch (RestClientResponseException ex) {
      final MatchProviderException mapped = mapResponseException(ex, "findAccount");
      if (mapped.reason() == MatchProviderException.Reason.NOT_FOUND) {
        return Optional.empty();
      }
      throw mapped;
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, "findAccount");
    } catch (RuntimeException ex) {
      logger.warn("match provider findAccount response parse failed", ex);
      throw new MatchProviderException(
          MatchProviderException.Reason.INVALID_RESPONSE, "match provider response parse failed", ex);
    }
  }

  private MatchRecord toMatchRecord(HenrikMatchesResponse.Match match) {
    if (match == null || match.metadata() == null || isBlank(match.metadata().matchid())) {
      throw new MatchProviderException(
          MatchProviderException.Reason.INVALID_RESPONSE, "match metadata is missing");
    }
    final Map<String, HenrikMatchesResponse.Team> teams =
        match.teams() == null ? Map.of() : match.teams();
    final Map<String, PlayerStats> players = new LinkedHashMap<>();
    if (match.players() != null && match.players().allPlayers() != null) {
      for (HenrikMatchesResponse.Player player : match.players().allPlayers()) {
        if (player == null || isBlank(player.name()) || isBlank(player.tag())) {
          continue;
        }
        final String team = player.team() == null ? "" : player.team().toLowerCase(Locale.ROOT);
        final HenrikMatchesResponse.Team teamResult = teams.get(team);
        final HenrikMatchesResponse.Stats stats = player.stats();
        final PlayerStats playerStats =
            new PlayerStats(
                player.name(),
                player.tag(),
                team,
                player.character(),
                stats == null ? 0 : stats.kills(),
                stats == null ? 0 : stats.deaths(),
                stats == null ? 0 : stats.assists(),
                teamResult != null && Boolean.TRUE.equals(teamResult.hasWon()));
        players.put(playerStats.accountKey(), playerStats);
      }
    }
    return new MatchRecord(
        match.metadata().matchid(),
        match.metadata().mode(),
        match.metadata().map(),
        roundsWon(teams.get("red")),
        roundsWon(teams.get("blue")),
        players);
  }

  private int roundsWon(HenrikMatchesResponse.Team team) {
    return team == null || team.roundsWon() == null ? 0 : team.roundsWon();
  }

  private MatchProviderException mapResponseException(
      RestClientResponseException ex, String operation) {
    final int status = ex.getStatusCode().value();
    logger.warn(
        "match provider {} failed with http status={} statusText={}",
        operation,
        status,
        ex.getStatusText());
    if (status == 404) {
      return new MatchProviderException(
          MatchProviderException.Reason.NOT_FOUND, "match provider account not found", ex);
    }
    if (status == 429) {
      return new MatchProviderException(
          MatchProviderException.Reason.RATE_LIMITED,
          "match provider rate limited",
          parseRetryAfter(ex.getResponseHeaders()),
          ex);
    }
    return new MatchProviderException(
        MatchProviderException.Reason.UNAVAILABLE, "match provider request failed", ex);
  }

  private MatchProviderException mapResourceException(
      ResourceAccessException ex, String operation) {
    if (isTimeout(ex)) {
      logger.warn("match provider {} timed out", operation);
      return new MatchProviderException(
          MatchProviderException.Reason.TIMEOUT, "match provider request timeout", ex);
    }
    logger.warn("match provider {} connection failed", operation, ex);
    return new MatchProviderException(
        MatchProviderException.Reason.UNAVAILABLE, "match provider connection failed", ex);
  }

  private Duration parseRetryAfter(HttpHeaders headers) {
    if (headers == null) {
      return null;
    }
    final String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
    if (isBlank(value)) {
      return null;
    }
    try {
      final long seconds = Long.parseLong(value.trim());
      return seconds < 0 ? null : Duration.ofSeconds(seconds);
    } catch (NumberFormatException ex) {
      // HTTP-date 形式は扱わず計算済みバックオフへ委ねる
      logger.debug("unparseable Retry-After header value={}", value);
      return null;
    }
  }

  private void validateRiotId(String riotName, String riotTag) {
    if (isBlank(riotName) || isBlank(riotTag)) {
      throw new IllegalArgumentException("riotName and riotTag are required");
    }
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
