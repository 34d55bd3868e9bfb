/*
 * どこで: Squad 設定
 * 何を: デバウンス窓タイマー用スケジューラと解決サイクル用 Executor を提供する
 * なぜ: API 待ちや HTTP でブロックする解決処理をタイマースレッドから切り離すため
 */
package com.example.squad_announcer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class SchedulingConfig {

  @Bean
  public ThreadPoolTaskScheduler groupTimerScheduler(SquadTrackingProperties properties) {
    final ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(properties.timerPoolSize());
    scheduler.setThreadNamePrefix("group-timer-");
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setWaitForTasksToCompleteOnShutdown(false);
    return scheduler;
  }

  @Bean
  public ThreadPoolTaskExecutor resolutionExecutor(SquadTrackingProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.resolverPoolSize());
    executor.setMaxPoolSize(properties.resolverPoolSize());
    executor.setThreadNamePrefix("squad-resolver-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    return executor;
  }
}
