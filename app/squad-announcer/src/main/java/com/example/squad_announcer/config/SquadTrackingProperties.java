/*
 * どこで: Squad 設定
 * 何を: デバウンス窓・API 反映待ち・モード制限などの追跡設定を保持する
 * なぜ: 待機時間や対象モードを運用で調整できるようにするため
 */
package com.example.squad_announcer.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "squad.tracking")
@Validated
public record SquadTrackingProperties(
    @NotNull Duration groupWaitTime,
    @NotNull Duration maxGroupWait,
    @NotNull Duration apiWaitTime,
    boolean competitiveOnly,
    @NotNull Duration memberRetryDelay,
    @NotNull Duration sessionMaxAge,
    @NotNull @Positive Integer resolverPoolSize,
    @NotNull @Positive Integer timerPoolSize) {

  @AssertTrue(message = "squad.tracking.group-wait-time must be positive")
  public boolean isGroupWaitTimePositive() {
    return isPositive(groupWaitTime);
  }

  @AssertTrue(message = "squad.tracking.max-group-wait must not be shorter than group-wait-time")
  public boolean isMaxGroupWaitCoveringGroupWait() {
    return groupWaitTime == null
        || maxGroupWait == null
        || maxGroupWait.compareTo(groupWaitTime) >= 0;
  }

  @AssertTrue(message = "squad.tracking.api-wait-time must not be negative")
  public boolean isApiWaitTimeNotNegative() {
    return apiWaitTime == null || !apiWaitTime.isNegative();
  }

  private boolean isPositive(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
