/*
 * どこで: Squad サービス層テスト
 * 何を: SquadResolver の matchId 照合とメンバー単位の失敗処理を検証する
 * なぜ: 同じ試合の仲間だけが 1 つの告知にまとまり、解決後に誰も PENDING に残らないことを保証するため
 */
package com.example.squad_announcer.service;

import static com.example.squad_announcer.service.SquadFixtures.T0;
import static com.example.squad_announcer.service.SquadFixtures.match;
import static com.example.squad_announcer.service.SquadFixtures.registration;
import static com.example.squad_announcer.service.SquadFixtures.stats;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.squad_announcer.model.AnnouncementBatch;
import com.example.squad_announcer.model.BatchMember;
import com.example.squad_announcer.model.DropReason;
import com.example.squad_announcer.model.DroppedMember;
import com.example.squad_announcer.model.FetchFailure;
import com.example.squad_announcer.model.MatchFetchResult;
import com.example.squad_announcer.model.MatchRecord;
import com.example.squad_announcer.model.Region;
import com.example.squad_announcer.model.Registration;
import com.example.squad_announcer.model.ResolutionOutcome;
import com.example.squad_announcer.model.SessionEnded;
import com.example.squad_announcer.repository.RegistrationRepository;
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
class SquadResolverTest {

  private static final String TENANT = "tenant-1";

  @Mock private RegistrationRepository registrationRepository;
  @Mock private MatchFetcher matchFetcher;
  @Mock private ActivityTracker activityTracker;

  private final List<Duration> sleeps = new ArrayList<>();
  private SquadResolver resolver;

  @BeforeEach
  void setUp() {
    resolver =
        new SquadResolver(
            registrationRepository,
            matchFetcher,
            activityTracker,
            SquadFixtures.trackingProperties(),
            SquadFixtures.fetchProperties(),
            sleeps::add,
            new AnnouncementMetrics(new SimpleMeterRegistry()));
  }

  @Test
  void membersOfSameMatchFormOneBatch() throws InterruptedException {
    final MatchRecord shared =
        match("m-1", stats("Alpha", "red", true), stats("Bravo", "red", true));
    registered("user-a", "Alpha");
    registered("user-b", "Bravo");
    when(matchFetcher.fetch(Region.NA, "Alpha", "NA1"))
        .thenReturn(MatchFetchResult.success(shared, 1));
    when(matchFetcher.fetch(Region.NA, "Bravo", "NA1"))
        .thenReturn(MatchFetchResult.success(shared, 1));

    final ResolutionOutcome outcome =
        resolver.resolve(TENANT, List.of(ended("user-a"), ended("user-b")));

    assertThat(outcome.batches()).hasSize(1);
    assertThat(outcome.batches().get(0).matchId()).isEqualTo("m-1");
    assertThat(outcome.batches().get(0).members())
        .extracting(BatchMember::userId)
        .containsExactly("user-a", "user-b");
    assertThat(outcome.dropped()).isEmpty();
    verify(matchFetcher, times(1)).awaitSettle();
  }

  @Test
  void membersOfDifferentMatchesAreSplit() {
    registered("user-a", "Alpha");
    registered("user-b", "Bravo");
    when(matchFetcher.fetch(Region.NA, "Alpha", "NA1"))
        .thenReturn(MatchFetchResult.success(match("m-1", stats("Alpha", "red", true)), 1));
    when(matchFetcher.fetch(Region.NA, "Bravo", "NA1"))
        .thenReturn(MatchFetchResult.success(match("m-2", stats("Bravo", "blue", false)), 1));

    final ResolutionOutcome outcome =
        resolver.resolve(TENANT, List.of(ended("user-a"), ended("user-b")));

    assertThat(outcome.batches())
        .extracting(AnnouncementBatch::matchId)
        .containsExactly("m-1", "m-2");
    assertThat(outcome.batches()).allSatisfy(batch -> assertThat(batch.members()).hasSize(1));
  }

  @Test
  void soloMemberResolvesToSingletonBatch() {
    registered("user-c", "Charlie");
    when(matchFetcher.fetch(Region.NA, "Charlie", "NA1"))
        .thenReturn(MatchFetchResult.success(match("m-3", stats("Charlie", "blue", true)), 1));

    final ResolutionOutcome outcome = resolver.resolve(TENANT, List.of(ended("user-c")));

    assertThat(outcome.batches()).hasSize(1);
    assertThat(outcome.batches().get(0).members())
        .extracting(BatchMember::userId)
        .containsExactly("user-c");
  }

  @Test
  void unregisteredMemberIsDroppedWithoutFetching() throws InterruptedException {
    when(registrationRepository.find(TENANT, "user-x")).thenReturn(Optional.empty());

    final ResolutionOutcome outcome = resolver.resolve(TENANT, List.of(ended("user-x")));

    assertThat(outcome.batches()).isEmpty();
    assertThat(outcome.dropped())
        .containsExactly(new DroppedMember("user-x", DropReason.NOT_REGISTERED));
    verify(matchFetcher, never()).awaitSettle();
    verify(matchFetcher, never()).fetch(any(), anyString(), anyString());
  }

  @Test
  void memberMissingFromReturnedMatchIsDropped() {
    registered("user-a", "Alpha");
    when(matchFetcher.fetch(Region.NA, "Alpha", "NA1"))
        .thenReturn(MatchFetchResult.success(match("m-1", stats("Someone", "red", true)), 1));

    final ResolutionOutcome outcome = resolver.resolve(TENANT, List.of(ended("user-a")));

    assertThat(outcome.batches()).isEmpty();
    assertThat(outcome.dropped())
        .containsExactly(new DroppedMember("user-a", DropReason.NOT_IN_MATCH));
  }

  @Test
  void transientFailureIsRetriedOnceWithRemainingAttempts() {
    registered("user-a", "Alpha");
    when(matchFetcher.fetch(Region.NA, "Alpha", "NA1"))
        .thenReturn(MatchFetchResult.failed(FetchFailure.RATE_LIMITED, 2));
    when(matchFetcher.fetch(Region.NA, "Alpha", "NA1", 3))
        .thenReturn(MatchFetchResult.success(match("m-1", stats("Alpha", "red", true)), 1));

    final ResolutionOutcome outcome = resolver.resolve(TENANT, List.of(ended("user-a")));

    assertThat(outcome.batches()).hasSize(1);
    assertThat(sleeps).containsExactly(SquadFixtures.MEMBER_RETRY_DELAY);
  }

  @Test
  void transientFailureTwiceDropsMember() {
    registered("user-a", "Alpha");
    when(matchFetcher.fetch(Region.NA, "Alpha", "NA1"))
        .thenReturn(MatchFetchResult.failed(FetchFailure.UNAVAILABLE, 3));
    when(matchFetcher.fetch(Region.NA, "Alpha", "NA1", 2))
        .thenReturn(MatchFetchResult.failed(FetchFailure.UNAVAILABLE, 2));

    final ResolutionOutcome outcome = resolver.resolve(TENANT, List.of(ended("user-a")));

    assertThat(outcome.dropped())
        .containsExactly(new DroppedMember("user-a", DropReason.UNAVAILABLE));
    verify(matchFetcher, times(1)).fetch(Region.NA, "Alpha", "NA1");
    verify(matchFetcher, times(1)).fetch(Region.NA, "Alpha", "NA1", 2);
  }

  @Test
  void transientFailureIsNotRetriedWhenAttemptsAreExhausted() {
    registered("user-a", "Alpha");
    when(matchFetcher.fetch(Region.NA, "Alpha", "NA1"))
        .thenReturn(MatchFetchResult.failed(FetchFailure.RATE_LIMITED, 5));

    final ResolutionOutcome outcome = resolver.resolve(TENANT, List.of(ended("user-a")));

    assertThat(outcome.dropped())
        .containsExactly(new DroppedMember("user-a", DropReason.RATE_LIMITED));
    assertThat(sleeps).isEmpty();
    verify(matchFetcher, never()).fetch(any(), anyString(), anyString(), anyInt());
  }

  @Test
  void providerCallsPerAccountStayWithinMaxAttemptsAcrossRetry() {
    final MatchProviderClient matchProviderClient = mock(MatchProviderClient.class);
    when(matchProviderClient.lastMatch(Region.NA, "Alpha", "NA1"))
        .thenThrow(
            new MatchProviderException(MatchProviderException.Reason.UNAVAILABLE, "502"));
    final List<Duration> fetcherSleeps = new ArrayList<>();
    final MatchFetcher realFetcher =
        new MatchFetcher(
            matchProviderClient,
            SquadFixtures.fetchProperties(),
            SquadFixtures.trackingProperties(),
            fetcherSleeps::add,
            new AnnouncementMetrics(new SimpleMeterRegistry()));
    final SquadResolver boundedResolver =
        new SquadResolver(
            registrationRepository,
            realFetcher,
            activityTracker,
            SquadFixtures.trackingProperties(),
            SquadFixtures.fetchProperties(),
            sleeps::add,
            new AnnouncementMetrics(new SimpleMeterRegistry()));
    registered("user-a", "Alpha");

    final ResolutionOutcome outcome = boundedResolver.resolve(TENANT, List.of(ended("user-a")));

    // 1 回目は unavailable の上限 3 回で止まり、再取得は残り 2 回だけ使う
    assertThat(outcome.dropped())
        .containsExactly(new DroppedMember("user-a", DropReason.UNAVAILABLE));
    assertThat(sleeps).containsExactly(SquadFixtures.MEMBER_RETRY_DELAY);
    verify(matchProviderClient, times(SquadFixtures.fetchProperties().maxAttempts()))
        .lastMatch(Region.NA, "Alpha", "NA1");
  }

  @Test
  void permanentFailureIsNotRetried() {
    registered("user-a", "Alpha");
    when(matchFetcher.fetch(Region.NA, "Alpha", "NA1"))
        .thenReturn(MatchFetchResult.failed(FetchFailure.MODE_EXCLUDED, 1));

    final ResolutionOutcome outcome = resolver.resolve(TENANT, List.of(ended("user-a")));

    assertThat(outcome.dropped())
        .containsExactly(new DroppedMember("user-a", DropReason.MODE_EXCLUDED));
    assertThat(sleeps).isEmpty();
    verify(matchFetcher, times(1)).fetch(Region.NA, "Alpha", "NA1");
  }

  @Test
  void sharedAccountIsFetchedOnce() {
    when(registrationRepository.find(TENANT, "user-a"))
        .thenReturn(Optional.of(registration(TENANT, "user-a", "Alpha")));
    when(registrationRepository.find(TENANT, "user-alt"))
        .thenReturn(Optional.of(registration(TENANT, "user-alt", "alpha")));
    when(matchFetcher.fetch(eq(Region.NA), anyString(), eq("NA1")))
        .thenReturn(MatchFetchResult.success(match("m-1", stats("Alpha", "red", true)), 1));

    final ResolutionOutcome outcome =
        resolver.resolve(TENANT, List.of(ended("user-a"), ended("user-alt")));

    assertThat(outcome.batches().get(0).members()).hasSize(2);
    verify(matchFetcher, times(1)).fetch(eq(Region.NA), anyString(), eq("NA1"));
  }

  @Test
  void streamingFlagComesFromEndedSession() {
    registered("user-a", "Alpha");
    when(matchFetcher.fetch(Region.NA, "Alpha", "NA1"))
        .thenReturn(MatchFetchResult.success(match("m-1", stats("Alpha", "red", true)), 1));

    final ResolutionOutcome outcome =
        resolver.resolve(
            TENANT,
            List.of(new SessionEnded(TENANT, "user-a", "v-1", true, T0.minusSeconds(1800), T0)));

    assertThat(outcome.batches().get(0).members().get(0).streaming()).isTrue();
  }

  @Test
  void membersAreReleasedEvenWhenResolutionThrows() {
    registered("user-a", "Alpha");
    when(matchFetcher.fetch(Region.NA, "Alpha", "NA1"))
        .thenThrow(new IllegalStateException("boom"));

    assertThatThrownBy(() -> resolver.resolve(TENANT, List.of(ended("user-a"))))
        .isInstanceOf(IllegalStateException.class);

    verify(activityTracker).release(TENANT, List.of("user-a"));
  }

  @Test
  void membersAreReleasedAfterSuccessfulResolution() {
    when(registrationRepository.find(TENANT, "user-x")).thenReturn(Optional.empty());

    resolver.resolve(TENANT, List.of(ended("user-x")));

    verify(activityTracker).release(TENANT, List.of("user-x"));
  }

  @Test
  void memberFromAnotherTenantIsRejected() {
    final SessionEnded foreign =
        new SessionEnded("tenant-2", "user-a", "v-1", false, T0.minusSeconds(60), T0);

    assertThatThrownBy(() -> resolver.resolve(TENANT, List.of(foreign)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private void registered(String userId, String riotName) {
    final Registration registration = registration(TENANT, userId, riotName);
    when(registrationRepository.find(TENANT, userId)).thenReturn(Optional.of(registration));
  }

  private SessionEnded ended(String userId) {
    return new SessionEnded(TENANT, userId, "v-1", false, T0.minusSeconds(1800), T0);
  }
}
