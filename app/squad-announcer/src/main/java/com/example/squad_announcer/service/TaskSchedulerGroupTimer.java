/*
 * どこで: Squad サービス層
 * 何を: GroupTimer を Spring の TaskScheduler 上で実装する
 * なぜ: 窓満了を専用スレッドプールで発火させるため
 */
package com.example.squad_announcer.service;

import com.example.squad_announcer.model.GroupKey;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

@Component
public class TaskSchedulerGroupTimer implements GroupTimer {

  private static final Logger logger = LoggerFactory.getLogger(TaskSchedulerGroupTimer.class);

  private final TaskScheduler scheduler;
  private final ConcurrentMap<GroupKey, ScheduledFuture<?>> scheduled = new ConcurrentHashMap<>();

  public TaskSchedulerGroupTimer(@Qualifier("groupTimerScheduler") TaskScheduler scheduler) {
    this.scheduler = scheduler;
  }

  @Override
  public void schedule(GroupKey key, Instant deadline, Runnable task) {
    final AtomicReference<ScheduledFuture<?>> self = new AtomicReference<>();
    final Runnable wrapped =
        () -> {
          try {
            task.run();
          } catch (RuntimeException ex) {
            logger.error("group timer task failed groupKey={}", key, ex);
          } finally {
            final ScheduledFuture<?> own = self.get();
            if (own != null) {
              scheduled.remove(key, own);
            }
          }
        };
    final ScheduledFuture<?> future = scheduler.schedule(wrapped, deadline);
    self.set(future);
    final ScheduledFuture<?> previous = scheduled.put(key, future);
    if (previous != null) {
      // 実行中のタスクは割り込まない。古い発火は GroupCollector 側で締切を見て無視される
      previous.cancel(false);
    }
  }
}
