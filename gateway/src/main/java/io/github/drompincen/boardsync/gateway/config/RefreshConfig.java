package io.github.drompincen.boardsync.gateway.config;

import io.github.drompincen.boardsync.runtime.refresh.RefreshScheduler;
import io.github.drompincen.boardsync.runtime.subscription.SubscriptionPublisher;
import io.github.drompincen.boardsync.runtime.watch.DbWatcher;
import io.github.drompincen.boardsync.runtime.workspace.WorkspaceContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Wires the change notifier to the refresh scheduler. Both share one timer thread; refresh
 * passes run on their own thread.
 */
@Configuration
public class RefreshConfig {

    @Bean(destroyMethod = "shutdownNow")
    ScheduledExecutorService refreshTimer() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "refresh-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService refreshPassExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "refresh-pass");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean(destroyMethod = "close")
    RefreshScheduler refreshScheduler(@Qualifier("refreshTimer") ScheduledExecutorService refreshTimer,
                                      @Qualifier("refreshPassExecutor") ExecutorService refreshPassExecutor,
                                      SubscriptionPublisher publisher,
                                      @Value("${boardsync.refresh.debounce-ms:75}") long debounceMs,
                                      @Value("${boardsync.refresh.mutation-gate-ms:500}") long gateMs) {
        return new RefreshScheduler(refreshTimer, refreshPassExecutor, publisher, debounceMs, gateMs);
    }

    @Bean(destroyMethod = "close")
    DbWatcher dbWatcher(@Qualifier("refreshTimer") ScheduledExecutorService refreshTimer,
                        RefreshScheduler refreshScheduler,
                        WorkspaceContext workspace,
                        @Value("${boardsync.watch.debounce-ms:250}") long debounceMs,
                        @Value("${boardsync.watch.cooldown-ms:1000}") long cooldownMs) {
        DbWatcher watcher = new DbWatcher(refreshTimer, Clock.systemUTC(), debounceMs, cooldownMs);
        watcher.addListener(refreshScheduler::onStoreChanged);
        watcher.start(workspace.current());
        return watcher;
    }
}
