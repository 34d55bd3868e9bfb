/*
 * どこで: Squad API レスポンス DTO
 * 何を: 登録結果を定義する
 * なぜ: 登録済み Riot ID とリージョンを呼び出し元へ返すため
 */
package com.example.squad_announcer.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RegistrationResponse(
    String tenantId,
    String userId,
    String riotName,
    String riotTag,
    String region,
    String registeredAt) {}
