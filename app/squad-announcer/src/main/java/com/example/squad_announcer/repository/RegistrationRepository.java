/*
 * どこで: Squad データアクセス
 * 何を: registrations の登録/削除/取得を担う
 * なぜ: 追跡対象ユーザーと Riot ID の対応をテナント単位で保持するため
 */
package com.example.squad_announcer.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.squad_announcer.model.Region;
import com.example.squad_announcer.model.Registration;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class RegistrationRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** 同一 (tenant, user) の再登録は Riot ID を上書きする。 */
  public void upsert(Registration registration) {
    final String sql =
        """
        INSERT INTO registrations (tenant_id, user_id, riot_name, riot_tag, region, registered_at)
        VALUES (:tenantId, :userId, :riotName, :riotTag, :region, :registeredAt)
        ON CONFLICT (tenant_id, user_id) DO UPDATE
        SET riot_name = EXCLUDED.riot_name,
            riot_tag = EXCLUDED.riot_tag,
            region = EXCLUDED.region,
            registered_at = EXCLUDED.registered_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", registration.tenantId())
            .addValue("userId", registration.userId())
            .addValue("riotName", registration.riotName())
            .addValue("riotTag", registration.riotTag())
            .addValue("region", registration.region().value())
            .addValue("registeredAt", toTimestamp(registration.registeredAt()));
    jdbcTemplate.update(sql, params);
  }

  public boolean delete(String tenantId, String userId) {
    final String sql =
        """
        DELETE FROM registrations
        WHERE tenant_id = :tenantId
          AND user_id = :userId
        """;
    return jdbcTemplate.update(sql, keyParams(tenantId, userId)) > 0;
  }

  public Optional<Registration> find(String tenantId, String userId) {
    final String sql =
        """
        SELECT tenant_id, user_id, riot_name, riot_tag, region, registered_at
        FROM registrations
        WHERE tenant_id = :tenantId
          AND user_id = :userId
        """;
    final List<Registration> rows =
        jdbcTemplate.query(sql, keyParams(tenantId, userId), this::mapRow);
    return rows.stream().findFirst();
  }

  public boolean exists(String tenantId, String userId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM registrations
        WHERE tenant_id = :tenantId
          AND user_id = :userId
        """;
    final Integer count =
        jdbcTemplate.queryForObject(sql, keyParams(tenantId, userId), Integer.class);
    return count != null && count > 0;
  }

  public List<Registration> findByTenant(String tenantId) {
    final String sql =
        """
        SELECT tenant_id, user_id, riot_name, riot_tag, region, registered_at
        FROM registrations
        WHERE tenant_id = :tenantId
        ORDER BY registered_at, user_id
        """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("tenantId", tenantId), this::mapRow);
  }

  private MapSqlParameterSource keyParams(String tenantId, String userId) {
    return new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("userId", userId);
  }

  private Registration mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Registration(
        rs.getString("tenant_id"),
        rs.getString("user_id"),
        rs.getString("riot_name"),
        rs.getString("riot_tag"),
        Region.fromValue(rs.getString("region")),
        toInstant(rs.getTimestamp("registered_at")));
  }
}
