/*
 * どこで: Squad サービス層テスト
 * 何を: MatchFetcher のリトライ/バックオフと失敗分類を検証する
 * なぜ: レート制限下でも試行回数の上限を守りつつ取得できることを保証するため
 */
package com.example.squad_announcer.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.squad_announcer.config.MatchFetchProperties;
import com.example.squad_announcer.model.FetchFailure;
import com.example.squad_announcer.model.MatchFetchResult;
import com.example.squad_announcer.model.MatchRecord;
import com.example.squad_announcer.model.Region;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MatchFetcherTest {

  private static final String NAME = "Alpha";
  private static final String TAG = "NA1";

  @Mock private MatchProviderClient matchProviderClient;

  private final List<Duration> sleeps = new ArrayList<>();
  private SimpleMeterRegistry meterRegistry;
  private MatchFetcher fetcher;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    fetcher = newFetcher(SquadFixtures.fetchProperties(), true);
  }

  @Test
  void returnsMatchAfterThreeRateLimitedResponses() {
    final MatchRecord match = SquadFixtures.match("m-1", SquadFixtures.stats(NAME, "red", true));
    when(matchProviderClient.lastMatch(Region.NA, NAME, TAG))
        .thenThrow(rateLimited(Duration.ofSeconds(2)))
        .thenThrow(rateLimited(Duration.ofSeconds(2)))
        .thenThrow(rateLimited(Duration.ofSeconds(2)))
        .thenReturn(Optional.of(match));

    final MatchFetchResult result = fetcher.fetch(Region.NA, NAME, TAG);

    assertThat(result.succeeded()).isTrue();
    assertThat(result.match().matchId()).isEqualTo("m-1");
    assertThat(result.attempts()).isEqualTo(4);
    assertThat(sleeps).containsExactly(
        Duration.ofSeconds(2), Duration.ofSeconds(2), Duration.ofSeconds(2));
    assertThat(
            meterRegistry
                .get(AnnouncementMetrics.METRIC_FETCH_ATTEMPT_TOTAL)
                .tag("outcome", "rate_limited")
                .counter()
                .count())
        .isEqualTo(3.0d);
  }

  @Test
  void neverExceedsMaxAttempts() {
    when(matchProviderClient.lastMatch(Region.NA, NAME, TAG))
        .thenThrow(rateLimited(Duration.ofSeconds(1)));

    final MatchFetchResult result = fetcher.fetch(Region.NA, NAME, TAG);

    assertThat(result.succeeded()).isFalse();
    assertThat(result.failure()).isEqualTo(FetchFailure.RATE_LIMITED);
    assertThat(result.attempts()).isEqualTo(5);
    assertThat(sleeps).hasSize(4);
    verify(matchProviderClient, times(5)).lastMatch(Region.NA, NAME, TAG);
  }

  @Test
  void attemptBudgetLimitsProviderCalls() {
    when(matchProviderClient.lastMatch(Region.NA, NAME, TAG))
        .thenThrow(rateLimited(Duration.ofSeconds(1)));

    final MatchFetchResult result = fetcher.fetch(Region.NA, NAME, TAG, 2);

    assertThat(result.failure()).isEqualTo(FetchFailure.RATE_LIMITED);
    assertThat(result.attempts()).isEqualTo(2);
    assertThat(sleeps).hasSize(1);
    verify(matchProviderClient, times(2)).lastMatch(Region.NA, NAME, TAG);
  }

  @Test
  void nonPositiveAttemptBudgetIsRejected() {
    assertThatThrownBy(() -> fetcher.fetch(Region.NA, NAME, TAG, 0))
        .isInstanceOf(IllegalArgumentException.class);

    verifyNoInteractions(matchProviderClient);
  }

  @Test
  void retryAfterIsCappedAtConfiguredMaximum() {
    when(matchProviderClient.lastMatch(Region.NA, NAME, TAG))
        .thenThrow(rateLimited(Duration.ofMinutes(10)))
        .thenReturn(Optional.of(SquadFixtures.match("m-1")));

    fetcher.fetch(Region.NA, NAME, TAG);

    assertThat(sleeps).containsExactly(Duration.ofSeconds(60));
  }

  @Test
  void rateLimitWithoutRetryAfterUsesComputedBackoff() {
    when(matchProviderClient.lastMatch(Region.NA, NAME, TAG))
        .thenThrow(rateLimited(null))
        .thenThrow(rateLimited(null))
        .thenReturn(Optional.of(SquadFixtures.match("m-1")));

    fetcher.fetch(Region.NA, NAME, TAG);

    assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
  }

  @Test
  void unavailableResponsesStopAtTheirOwnBudget() {
    when(matchProviderClient.lastMatch(Region.NA, NAME, TAG))
        .thenThrow(
            new MatchProviderException(MatchProviderException.Reason.UNAVAILABLE, "503"));

    final MatchFetchResult result = fetcher.fetch(Region.NA, NAME, TAG);

    assertThat(result.failure()).isEqualTo(FetchFailure.UNAVAILABLE);
    assertThat(result.attempts()).isEqualTo(3);
    assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
  }

  @Test
  void timeoutCountsAsUnavailable() {
    when(matchProviderClient.lastMatch(Region.NA, NAME, TAG))
        .thenThrow(new MatchProviderException(MatchProviderException.Reason.TIMEOUT, "timeout"))
        .thenReturn(Optional.of(SquadFixtures.match("m-1")));

    final MatchFetchResult result = fetcher.fetch(Region.NA, NAME, TAG);

    assertThat(result.succeeded()).isTrue();
    assertThat(result.attempts()).isEqualTo(2);
  }

  @Test
  void notFoundIsNotRetried() {
    when(matchProviderClient.lastMatch(Region.NA, NAME, TAG))
        .thenThrow(new MatchProviderException(MatchProviderException.Reason.NOT_FOUND, "404"));

    final MatchFetchResult result = fetcher.fetch(Region.NA, NAME, TAG);

    assertThat(result.failure()).isEqualTo(FetchFailure.NOT_FOUND);
    assertThat(result.attempts()).isEqualTo(1);
    assertThat(sleeps).isEmpty();
  }

  @Test
  void emptyHistoryIsNotFound() {
    when(matchProviderClient.lastMatch(Region.NA, NAME, TAG)).thenReturn(Optional.empty());

    final MatchFetchResult result = fetcher.fetch(Region.NA, NAME, TAG);

    assertThat(result.failure()).isEqualTo(FetchFailure.NOT_FOUND);
    assertThat(sleeps).isEmpty();
  }

  @Test
  void nonCompetitiveMatchIsExcludedWhenCompetitiveOnly() {
    when(matchProviderClient.lastMatch(Region.NA, NAME, TAG))
        .thenReturn(Optional.of(SquadFixtures.match("m-1", "Unrated")));

    final MatchFetchResult result = fetcher.fetch(Region.NA, NAME, TAG);

    assertThat(result.failure()).isEqualTo(FetchFailure.MODE_EXCLUDED);
  }

  @Test
  void nonCompetitiveMatchIsAcceptedWhenAllModesAllowed() {
    final MatchFetcher allModes = newFetcher(SquadFixtures.fetchProperties(), false);
    when(matchProviderClient.lastMatch(Region.NA, NAME, TAG))
        .thenReturn(Optional.of(SquadFixtures.match("m-1", "Unrated")));

    final MatchFetchResult result = allModes.fetch(Region.NA, NAME, TAG);

    assertThat(result.succeeded()).isTrue();
  }

  @Test
  void interruptedBackoffReturnsFailureAndKeepsInterruptFlag() {
    final MatchFetcher interrupted =
        new MatchFetcher(
            matchProviderClient,
            SquadFixtures.fetchProperties(),
            SquadFixtures.trackingProperties(),
            duration -> {
              throw new InterruptedException("stop");
            },
            new AnnouncementMetrics(meterRegistry));
    when(matchProviderClient.lastMatch(Region.NA, NAME, TAG))
        .thenThrow(rateLimited(Duration.ofSeconds(1)));

    final MatchFetchResult result = interrupted.fetch(Region.NA, NAME, TAG);

    assertThat(result.failure()).isEqualTo(FetchFailure.RATE_LIMITED);
    assertThat(result.attempts()).isEqualTo(1);
    assertThat(Thread.interrupted()).isTrue();
  }

  @Test
  void awaitSettleSleepsApiWaitTime() throws InterruptedException {
    fetcher.awaitSettle();

    assertThat(sleeps).containsExactly(SquadFixtures.API_WAIT);
  }

  @Test
  void computeBackoffDurationStaysWithinJitterAndCap() {
    final MatchFetcher jittered =
        newFetcher(
            new MatchFetchProperties(
                5,
                3,
                Duration.ofSeconds(1),
                Duration.ofSeconds(30),
                2.0,
                0.5,
                1.5,
                Duration.ofMillis(500),
                Duration.ofSeconds(60)),
            true);

    for (int i = 0; i < 50; i++) {
      assertThat(jittered.computeBackoffDuration(1))
          .isBetween(Duration.ofMillis(500), Duration.ofMillis(1500));
      assertThat(jittered.computeBackoffDuration(10))
          .isBetween(Duration.ofSeconds(15), Duration.ofSeconds(45));
    }
  }

  private MatchFetcher newFetcher(MatchFetchProperties properties, boolean competitiveOnly) {
    return new MatchFetcher(
        matchProviderClient,
        properties,
        SquadFixtures.trackingProperties(competitiveOnly),
        sleeps::add,
        new AnnouncementMetrics(meterRegistry));
  }

  private MatchProviderException rateLimited(Duration retryAfter) {
    return new MatchProviderException(
        MatchProviderException.Reason.RATE_LIMITED, "429", retryAfter, null);
  }
}
