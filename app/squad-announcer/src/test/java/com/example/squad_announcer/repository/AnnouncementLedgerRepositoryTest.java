/*
 * どこで: AnnouncementLedgerRepository の統合テスト
 * 何を: 最終告知 matchId の記録と取得を検証する
 * なぜ: 再起動後も同一試合の再告知を抑止できることを保証するため
 */
package com.example.squad_announcer.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.squad_announcer.AbstractPostgresContainerTest;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class AnnouncementLedgerRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-03-01T12:00:00Z");

  @Autowired private AnnouncementLedgerRepository ledgerRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM announcement_ledger", new MapSqlParameterSource());
  }

  @Test
  void recordAnnouncedOverwritesPreviousMatch() {
    ledgerRepository.recordAnnounced("tenant-1", List.of("user-a", "user-b"), "m-1", BASE_TIME);
    ledgerRepository.recordAnnounced(
        "tenant-1", List.of("user-a"), "m-2", BASE_TIME.plusSeconds(600));

    final Map<String, String> lastMatchIds =
        ledgerRepository.findLastMatchIds("tenant-1", List.of("user-a", "user-b", "user-c"));

    assertThat(lastMatchIds).containsEntry("user-a", "m-2").containsEntry("user-b", "m-1");
    assertThat(lastMatchIds).doesNotContainKey("user-c");
  }

  @Test
  void ledgerIsScopedByTenant() {
    ledgerRepository.recordAnnounced("tenant-1", List.of("user-a"), "m-1", BASE_TIME);

    assertThat(ledgerRepository.findLastMatchIds("tenant-2", List.of("user-a"))).isEmpty();
    assertThat(ledgerRepository.findLastMatchIds("tenant-1", List.of())).isEmpty();
  }
}
