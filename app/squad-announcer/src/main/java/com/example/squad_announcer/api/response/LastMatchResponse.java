/*
 * どこで: Squad API レスポンス DTO
 * 何を: 直近コンペティティブ試合の詳細を定義する
 * なぜ: スコアをプレイヤー視点 (自チーム - 相手) で返すため
 */
package com.example.squad_announcer.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LastMatchResponse(
    String matchId,
    String result,
    String score,
    String map,
    String agent,
    int kills,
    int deaths,
    int assists,
    String mode) {}
