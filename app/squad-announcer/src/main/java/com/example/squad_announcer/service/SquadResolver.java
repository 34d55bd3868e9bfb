/*
 * どこで: Squad サービス層
 * 何を: 待機グループのメンバーを試合 ID で照合し、試合ごとの告知バッチへ分割する
 * なぜ: 同じボイスチャンネルでも別試合だった仲間を誤って 1 つにまとめないため
 */
package com.example.squad_announcer.service;

import com.example.common.time.Sleeper;
import com.example.squad_announcer.config.MatchFetchProperties;
import com.example.squad_announcer.config.SquadTrackingProperties;
import com.example.squad_announcer.model.AnnouncementBatch;
import com.example.squad_announcer.model.BatchMember;
import com.example.squad_announcer.model.DropReason;
import com.example.squad_announcer.model.DroppedMember;
import com.example.squad_announcer.model.MatchFetchResult;
import com.example.squad_announcer.model.MatchRecord;
import com.example.squad_announcer.model.PlayerStats;
import com.example.squad_announcer.model.Registration;
import com.example.squad_announcer.model.ResolutionOutcome;
import com.example.squad_announcer.model.SessionEnded;
import com.example.squad_announcer.repository.RegistrationRepository;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SquadResolver {

  private static final Logger logger = LoggerFactory.getLogger(SquadResolver.class);

  private final RegistrationRepository registrationRepository;
  private final MatchFetcher matchFetcher;
  private final ActivityTracker activityTracker;
  private final SquadTrackingProperties properties;
  private final MatchFetchProperties fetchProperties;
  private final Sleeper sleeper;
  private final AnnouncementMetrics metrics;

  /**
   * 役割: メンバー集合を試合ごとのバッチへ解決する。
   * 動作: 登録確認 → 反映待ち → アカウント単位で 1 回ずつ取得 → 一時失敗のみ固定遅延後に 1 回再取得 → matchId で分割。
   *       再取得は 1 回目の残りの試行回数で行い、アカウントあたりの総試行回数は maxAttempts を超えない。
   *       結果にかかわらず全メンバーのセッションを IDLE へ戻す。
   */
  public ResolutionOutcome resolve(String tenantId, List<SessionEnded> members) {
    try {
      return doResolve(tenantId, members);
    } finally {
      activityTracker.release(tenantId, members.stream().map(SessionEnded::userId).toList());
    }
  }

  private ResolutionOutcome doResolve(String tenantId, List<SessionEnded> members) {
    final List<DroppedMember> dropped = new ArrayList<>();
    final Map<String, Registration> registrations = new LinkedHashMap<>();
    final Map<String, SessionEnded> sessions = new LinkedHashMap<>();
    for (SessionEnded member : members) {
      if (!tenantId.equals(member.tenantId())) {
        throw new IllegalArgumentException("member belongs to another tenant: " + member.userId());
      }
      final Optional<Registration> registration =
          registrationRepository.find(tenantId, member.userId());
      if (registration.isEmpty()) {
        drop(dropped, member.userId(), DropReason.NOT_REGISTERED);
        continue;
      }
      registrations.put(member.userId(), registration.get());
      sessions.put(member.userId(), member);
    }
    if (registrations.isEmpty()) {
      return new ResolutionOutcome(tenantId, List.of(), dropped);
    }

    try {
      matchFetcher.awaitSettle();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      logger.warn("resolution interrupted during settle wait tenantId={}", tenantId);
      registrations.keySet().forEach(userId -> drop(dropped, userId, DropReason.UNAVAILABLE));
      return new ResolutionOutcome(tenantId, List.of(), dropped);
    }

    final Map<String, MatchFetchResult> resultsByAccount = new LinkedHashMap<>();
    for (Registration registration : registrations.values()) {
      resultsByAccount.computeIfAbsent(registration.accountKey(), ignored -> fetch(registration));
    }
    retryTransientFailures(registrations, resultsByAccount);

    final Map<String, MatchRecord> matchesById = new LinkedHashMap<>();
    final Map<String, List<BatchMember>> membersByMatch = new LinkedHashMap<>();
    for (Registration registration : registrations.values()) {
      final MatchFetchResult result = resultsByAccount.get(registration.accountKey());
      if (!result.succeeded()) {
        drop(dropped, registration.userId(), result.failure().dropReason());
        continue;
      }
      final MatchRecord match = result.match();
      final Optional<PlayerStats> stats = match.statsFor(registration.accountKey());
      if (stats.isEmpty()) {
        drop(dropped, registration.userId(), DropReason.NOT_IN_MATCH);
        continue;
      }
      matchesById.putIfAbsent(match.matchId(), match);
      membersByMatch
          .computeIfAbsent(match.matchId(), ignored -> new ArrayList<>())
          .add(
              new BatchMember(
                  registration.userId(),
                  registration.riotId(),
                  stats.get(),
                  sessions.get(registration.userId()).streaming()));
    }

    final List<AnnouncementBatch> batches = new ArrayList<>();
    membersByMatch.forEach(
        (matchId, batchMembers) ->
            batches.add(new AnnouncementBatch(tenantId, matchesById.get(matchId), batchMembers)));
    logger.info(
        "squad resolved tenantId={} members={} batches={} dropped={}",
        tenantId,
        members.size(),
        batches.size(),
        dropped.size());
    return new ResolutionOutcome(tenantId, batches, dropped);
  }

  private void retryTransientFailures(
      Map<String, Registration> registrations, Map<String, MatchFetchResult> resultsByAccount) {
    final List<Registration> retryTargets = new ArrayList<>();
    for (Registration registration : registrations.values()) {
      final MatchFetchResult result = resultsByAccount.get(registration.accountKey());
      if (!result.succeeded()
          && result.failure().transientFailure()
          && remainingAttempts(result) > 0
          && retryTargets.stream()
              .noneMatch(target -> target.accountKey().equals(registration.accountKey()))) {
        retryTargets.add(registration);
      }
    }
    if (retryTargets.isEmpty()) {
      return;
    }
    logger.info(
        "retrying transient match fetch failures accounts={} delayMs={}",
        retryTargets.size(),
        properties.memberRetryDelay().toMillis());
    try {
      sleeper.sleep(properties.memberRetryDelay());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      logger.warn("member retry interrupted; keeping first failures");
      return;
    }
    for (Registration registration : retryTargets) {
      final MatchFetchResult first = resultsByAccount.get(registration.accountKey());
      final MatchFetchResult retried =
          matchFetcher.fetch(
              registration.region(),
              registration.riotName(),
              registration.riotTag(),
              remainingAttempts(first));
      resultsByAccount.put(
          registration.accountKey(),
          retried.succeeded()
              ? retried
              : MatchFetchResult.failed(retried.failure(), first.attempts() + retried.attempts()));
    }
  }

  private int remainingAttempts(MatchFetchResult result) {
    return fetchProperties.maxAttempts() - result.attempts();
  }

  private MatchFetchResult fetch(Registration registration) {
    return matchFetcher.fetch(
        registration.region(), registration.riotName(), registration.riotTag());
  }

  private void drop(List<DroppedMember> dropped, String userId, DropReason reason) {
    dropped.add(new DroppedMember(userId, reason));
    metrics.recordDropped(reason);
    logger.info("member dropped from resolution userId={} reason={}", userId, reason.value());
  }
}
