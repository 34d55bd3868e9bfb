/*
 * どこで: Squad データアクセス
 * 何を: tenant_settings (告知チャンネル) の保存/取得を担う
 * なぜ: 告知先をテナントごとに切り替えるため
 */
package com.example.squad_announcer.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.squad_announcer.model.TenantSettings;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class TenantSettingsRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void upsertAnnouncementChannel(TenantSettings settings) {
    final String sql =
        """
        INSERT INTO tenant_settings (tenant_id, announcement_channel_id, updated_at)
        VALUES (:tenantId, :channelId, :updatedAt)
        ON CONFLICT (tenant_id) DO UPDATE
        SET announcement_channel_id = EXCLUDED.announcement_channel_id,
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", settings.tenantId())
            .addValue("channelId", settings.announcementChannelId())
            .addValue("updatedAt", toTimestamp(settings.updatedAt()));
    jdbcTemplate.update(sql, params);
  }

  public Optional<TenantSettings> find(String tenantId) {
    final String sql =
        """
        SELECT tenant_id, announcement_channel_id, updated_at
        FROM tenant_settings
        WHERE tenant_id = :tenantId
        """;
    final List<TenantSettings> rows =
        jdbcTemplate.query(
            sql,
            new MapSqlParameterSource().addValue("tenantId", tenantId),
            (rs, rowNum) ->
                new TenantSettings(
                    rs.getString("tenant_id"),
                    rs.getString("announcement_channel_id"),
                    toInstant(rs.getTimestamp("updated_at"))));
    return rows.stream().findFirst();
  }
}
