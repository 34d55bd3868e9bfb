/*
 * どこで: Common 共通設定
 * 何を: Clock と Sleeper を DI 可能にする
 * なぜ: 待機や時刻判定を伴う処理をテストで仮想時間に差し替えるため
 */
package com.example.common.config;

import com.example.common.time.Sleeper;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public Sleeper sleeper() {
    return Sleeper.threadSleeper();
  }
}
