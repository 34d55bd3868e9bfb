/*
 * どこで: Squad サービス層
 * 何を: アカウントの直近試合をリトライ/バックオフ付きで取得する
 * なぜ: レート制限のある提供元に対し試行回数の上限を守りつつ取りこぼしを減らすため
 */
package com.example.squad_announcer.service;

import com.example.common.time.Sleeper;
import com.example.squad_announcer.config.MatchFetchProperties;
import com.example.squad_announcer.config.SquadTrackingProperties;
import com.example.squad_announcer.model.FetchFailure;
import com.example.squad_announcer.model.MatchFetchResult;
import com.example.squad_announcer.model.MatchRecord;
import com.example.squad_announcer.model.Region;
import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MatchFetcher {

  private static final Logger logger = LoggerFactory.getLogger(MatchFetcher.class);

  private final MatchProviderClient matchProviderClient;
  private final MatchFetchProperties properties;
  private final SquadTrackingProperties trackingProperties;
  private final Sleeper sleeper;
  private final AnnouncementMetrics metrics;

  /** 提供元に試合が反映されるまで待つ。解決サイクルごとに 1 回だけ呼ぶ。 */
  public void awaitSettle() throws InterruptedException {
    sleeper.sleep(trackingProperties.apiWaitTime());
  }

  /**
   * 役割: 1 アカウントの直近試合を取得する。
   * 動作: 429 は Retry-After を優先したバックオフで再試行し、接続失敗/5xx は unavailableMaxAttempts まで再試行する。
   *       404 や履歴なしは再試行しない。総試行回数は maxAttempts を超えない。
   * 前提: 呼び出し側でアカウント単位の重複排除を行うこと。
   */
  public MatchFetchResult fetch(Region region, String riotName, String riotTag) {
    return fetch(region, riotName, riotTag, properties.maxAttempts());
  }

  /**
   * 試行回数の上限を attemptBudget に絞って取得する。同じサイクル内の再取得では、
   * 1 回目で使った回数を差し引いた残りを渡すこと。
   */
  public MatchFetchResult fetch(
      Region region, String riotName, String riotTag, int attemptBudget) {
    if (attemptBudget < 1) {
      throw new IllegalArgumentException("attemptBudget must be positive: " + attemptBudget);
    }
    final int maxAttempts = Math.min(attemptBudget, properties.maxAttempts());
    int attempts = 0;
    int unavailableAttempts = 0;
    while (true) {
      attempts++;
      Duration delay = Duration.ZERO;
      FetchFailure failure = FetchFailure.UNAVAILABLE;
      try {
        final Optional<MatchRecord> match =
            matchProviderClient.lastMatch(region, riotName, riotTag);
        if (match.isEmpty()) {
          metrics.recordFetchAttempt("not_found");
          logger.info("no recent match riotName={} attempts={}", riotName, attempts);
          return MatchFetchResult.failed(FetchFailure.NOT_FOUND, attempts);
        }
        metrics.recordFetchAttempt("success");
        if (trackingProperties.competitiveOnly() && !match.get().competitive()) {
          logger.info(
              "non-competitive match skipped riotName={} matchId={} mode={}",
              riotName,
              match.get().matchId(),
              match.get().mode());
          return MatchFetchResult.failed(FetchFailure.MODE_EXCLUDED, attempts);
        }
        return MatchFetchResult.success(match.get(), attempts);
      } catch (MatchProviderException ex) {
        switch (ex.reason()) {
          case NOT_FOUND -> {
            metrics.recordFetchAttempt("not_found");
            return MatchFetchResult.failed(FetchFailure.NOT_FOUND, attempts);
          }
          case RATE_LIMITED -> {
            metrics.recordFetchAttempt("rate_limited");
            failure = FetchFailure.RATE_LIMITED;
            delay = rateLimitDelay(ex.retryAfter(), attempts);
          }
          default -> {
            metrics.recordFetchAttempt("unavailable");
            unavailableAttempts++;
            if (unavailableAttempts >= properties.unavailableMaxAttempts()) {
              logger.warn(
                  "match fetch gave up after unavailable responses riotName={} attempts={}",
                  riotName,
                  attempts,
                  ex);
              return MatchFetchResult.failed(failure, attempts);
            }
            delay = computeBackoffDuration(attempts);
          }
        }
      }
      if (attempts >= maxAttempts) {
        logger.warn(
            "match fetch exhausted attempts riotName={} attempts={} failure={}",
            riotName,
            attempts,
            failure);
        return MatchFetchResult.failed(failure, attempts);
      }
      logger.info(
          "match fetch retry scheduled riotName={} attempt={} failure={} delayMs={}",
          riotName,
          attempts,
          failure,
          delay.toMillis());
      try {
        sleeper.sleep(delay);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        logger.warn("match fetch interrupted riotName={} attempts={}", riotName, attempts);
        return MatchFetchResult.failed(failure, attempts);
      }
    }
  }

  private Duration rateLimitDelay(Duration retryAfter, int attempt) {
    if (retryAfter == null) {
      return computeBackoffDuration(attempt);
    }
    final Duration capped =
        retryAfter.compareTo(properties.retryAfterMax()) > 0
            ? properties.retryAfterMax()
            : retryAfter;
    return capped.compareTo(properties.backoffMin()) < 0 ? properties.backoffMin() : capped;
  }

  @VisibleForTesting
  Duration computeBackoffDuration(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp = baseMillis * Math.pow(properties.backoffExponentBase(), attempt - 1);
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    final double jitterMin = properties.backoffJitterMin();
    final double jitterMax = properties.backoffJitterMax();
    final double jitter =
        jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    final long backoffMillis = (long) Math.ceil(capped * jitter);
    final long minMillis = properties.backoffMin().toMillis();
    return Duration.ofMillis(Math.max(minMillis, backoffMillis));
  }
}
