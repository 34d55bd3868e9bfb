/*
 * どこで: Squad 下流 DTO
 * 何を: Discord Create Message API のリクエストを表現する
 * なぜ: メンション付き本文と 1 件の埋め込みを型で組み立てるため
 */
package com.example.squad_announcer.service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiscordMessageRequest(
    String content, List<Embed> embeds, AllowedMentions allowedMentions) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Embed(
      String title, int color, List<EmbedField> fields, Footer footer, String timestamp) {}

  public record EmbedField(String name, String value, boolean inline) {}

  public record Footer(String text) {}

  /** 本文中のメンションのうち通知してよいユーザーだけを列挙する。 */
  public record AllowedMentions(List<String> users) {}
}
