/*
 * どこで: Squad 下流 DTO
 * 何を: 試合履歴 API (v3 matches) の応答を表現する
 * なぜ: 提供元の JSON 形状をドメインモデルへ変換する前段として型で受けるため
 */
package com.example.squad_announcer.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record HenrikMatchesResponse(Integer status, List<Match> data) {

  public HenrikMatchesResponse {
    data = data == null ? List.of() : List.copyOf(data);
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Match(Metadata metadata, Players players, Map<String, Team> teams) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Metadata(String matchid, String map, String mode) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Players(List<Player> allPlayers) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Player(String name, String tag, String team, String character, Stats stats) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Stats(int kills, int deaths, int assists) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Team(Boolean hasWon, Integer roundsWon, Integer roundsLost) {}
}
