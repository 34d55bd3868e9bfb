/*
 * どこで: Squad データアクセス
 * 何を: announcement_ledger (tenant, user) -> 最終告知 matchId を保持する
 * なぜ: 同一試合の再告知を再起動後も抑止するため
 */
package com.example.squad_announcer.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AnnouncementLedgerRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * 役割: 指定ユーザー群の最終告知 matchId を取得する。
   * 動作: 台帳に無いユーザーは結果 Map に含めない。
   */
  public Map<String, String> findLastMatchIds(String tenantId, Collection<String> userIds) {
    final Map<String, String> result = new HashMap<>();
    if (userIds.isEmpty()) {
      return result;
    }
    final String sql =
        """
        SELECT user_id, match_id
        FROM announcement_ledger
        WHERE tenant_id = :tenantId
          AND user_id IN (:userIds)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("userIds", userIds);
    final RowCallbackHandler collector =
        rs -> result.put(rs.getString("user_id"), rs.getString("match_id"));
    jdbcTemplate.query(sql, params, collector);
    return result;
  }

  /** 配信成功後にのみ呼ぶこと。 */
  public void recordAnnounced(
      String tenantId, List<String> userIds, String matchId, Instant announcedAt) {
    if (userIds.isEmpty()) {
      return;
    }
    final String sql =
        """
        INSERT INTO announcement_ledger (tenant_id, user_id, match_id, announced_at)
        VALUES (:tenantId, :userId, :matchId, :announcedAt)
        ON CONFLICT (tenant_id, user_id) DO UPDATE
        SET match_id = EXCLUDED.match_id,
            announced_at = EXCLUDED.announced_at
        """;
    final SqlParameterSource[] batch =
        userIds.stream()
            .map(
                userId ->
                    new MapSqlParameterSource()
                        .addValue("tenantId", tenantId)
                        .addValue("userId", userId)
                        .addValue("matchId", matchId)
                        .addValue("announcedAt", toTimestamp(announcedAt)))
            .toArray(SqlParameterSource[]::new);
    jdbcTemplate.batchUpdate(sql, batch);
  }
}
