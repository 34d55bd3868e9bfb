/*
 * どこで: Squad API レスポンス DTO
 * 何を: 直近コンペティティブ試合 (最大 5 試合) の集計を定義する
 * なぜ: 勝敗と合計/平均 K/D/A をまとめて返すため
 */
package com.example.squad_announcer.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RecentStatsResponse(
    String riotId,
    int matchCount,
    int wins,
    int losses,
    int totalKills,
    int totalDeaths,
    int totalAssists,
    double averageKills,
    double averageDeaths) {}
