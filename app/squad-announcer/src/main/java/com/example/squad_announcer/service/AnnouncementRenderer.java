/*
 * どこで: Squad サービス層
 * 何を: 告知バッチをタイトル/色/フィールド/フッターを持つ告知メッセージへ整形する
 * なぜ: 配信先に依存しない表示内容を 1 箇所で決めるため
 */
package com.example.squad_announcer.service;

import com.example.squad_announcer.model.AnnouncementBatch;
import com.example.squad_announcer.model.AnnouncementMessage;
import com.example.squad_announcer.model.BatchMember;
import com.example.squad_announcer.model.MatchRecord;
import com.example.squad_announcer.model.PlayerStats;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AnnouncementRenderer {

  static final int COLOR_WIN = 0x2ECC71;
  static final int COLOR_LOSS = 0xE74C3C;
  static final int COLOR_MIXED = 0xF1C40F;
  private static final String ZERO_WIDTH_SPACE = "\u200B";

  private final Clock clock;

  public AnnouncementMessage render(AnnouncementBatch batch) {
    if (batch.empty()) {
      throw new IllegalArgumentException("cannot render an empty batch");
    }
    final MatchRecord match = batch.match();
    final List<BatchMember> members = batch.members();
    final String title =
        members.size() == 1
            ? "🎮 Valorant Match Complete!"
            : "🎮 Squad Match Complete! (" + members.size() + " players)";

    final List<AnnouncementMessage.Field> fields = new ArrayList<>();
    fields.add(new AnnouncementMessage.Field("Map", match.map(), true));
    fields.add(new AnnouncementMessage.Field("Mode", match.mode(), true));
    fields.add(
        new AnnouncementMessage.Field(
            "Score", "🔴 " + match.redRounds() + " - " + match.blueRounds() + " 🔵", true));
    fields.add(new AnnouncementMessage.Field(ZERO_WIDTH_SPACE, "**Player Stats**", false));
    for (BatchMember member : members) {
      fields.add(new AnnouncementMessage.Field(member.riotId(), playerLine(member.stats()), false));
    }

    final String riotIds =
        members.stream().map(BatchMember::riotId).collect(Collectors.joining(", "));
    final boolean streaming = members.stream().anyMatch(BatchMember::streaming);
    return new AnnouncementMessage(
        batch.tenantId(),
        batch.matchId(),
        title,
        color(members),
        fields,
        streaming ? riotIds + " 📺 Streaming" : riotIds,
        members.stream().map(BatchMember::userId).toList(),
        Instant.now(clock));
  }

  private String playerLine(PlayerStats stats) {
    final String result = stats.won() ? "🏆" : "💀";
    final String team = "red".equals(stats.team()) ? "🔴" : "🔵";
    return String.format(
        Locale.ROOT,
        "%s %s **%s** | K/D/A: **%d/%d/%d** (KDA: %.2f)",
        result,
        team,
        stats.agent(),
        stats.kills(),
        stats.deaths(),
        stats.assists(),
        stats.kda());
  }

  // 先頭メンバーの勝敗で色を決め、チームが割れていれば金色
  private int color(List<BatchMember> members) {
    final long teams = members.stream().map(member -> member.stats().team()).distinct().count();
    if (teams > 1) {
      return COLOR_MIXED;
    }
    return members.get(0).stats().won() ? COLOR_WIN : COLOR_LOSS;
  }
}
