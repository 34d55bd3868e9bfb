/*
 * どこで: Squad 下流 DTO
 * 何を: アカウント API (v1 account) の応答を表現する
 * なぜ: 登録時の実在確認で必要な項目だけを受けるため
 */
package com.example.squad_announcer.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record HenrikAccountResponse(Integer status, Account data) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Account(String puuid, String region, Integer accountLevel, String name, String tag) {}
}
