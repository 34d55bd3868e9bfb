/*
 * どこで: Squad 設定
 * 何を: 試合データ取得のリトライ上限とバックオフ設定を保持する
 * なぜ: レート制限付き外部 API への再試行予算を外部化するため
 */
package com.example.squad_announcer.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "squad.fetch")
@Validated
public record MatchFetchProperties(
    @NotNull @Positive Integer maxAttempts,
    @NotNull @Positive Integer unavailableMaxAttempts,
    @NotNull Duration backoffBase,
    @NotNull Duration backoffMax,
    double backoffExponentBase,
    double backoffJitterMin,
    double backoffJitterMax,
    @NotNull Duration backoffMin,
    @NotNull Duration retryAfterMax) {

  @AssertTrue(message = "squad.fetch.unavailable-max-attempts must not exceed max-attempts")
  public boolean isUnavailableBudgetWithinTotal() {
    return maxAttempts == null
        || unavailableMaxAttempts == null
        || unavailableMaxAttempts <= maxAttempts;
  }

  @AssertTrue(message = "squad.fetch.backoff-jitter-min must not exceed backoff-jitter-max")
  public boolean isJitterRangeOrdered() {
    return backoffJitterMin > 0 && backoffJitterMin <= backoffJitterMax;
  }
}
