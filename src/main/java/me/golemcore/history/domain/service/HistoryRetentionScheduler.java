package me.golemcore.history.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.history.domain.model.CleanupResult;
import me.golemcore.history.infrastructure.config.HistoryProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically removes history older than {@code history.retention.days}.
 * Disabled unless {@code history.retention.enabled=true}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HistoryRetentionScheduler {

    private static final String LOG_PREFIX = "[Retention]";
    private static final long INITIAL_DELAY_SECONDS = 60;

    private final HistoryProperties properties;
    private final HistoryManager historyManager;

    private ScheduledExecutorService scheduler;

    @PostConstruct
    public void init() {
        HistoryProperties.RetentionProperties retention = properties.getRetention();
        if (!retention.isEnabled()) {
            log.info("{} Disabled", LOG_PREFIX);
            return;
        }
        Duration interval = retention.getInterval();
        if (interval == null || interval.isZero() || interval.isNegative() || retention.getDays() <= 0) {
            log.warn("{} Invalid settings (days={}, interval={}), not scheduling", LOG_PREFIX,
                    retention.getDays(), interval);
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "history-retention");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::runCleanup, INITIAL_DELAY_SECONDS, interval.toSeconds(),
                TimeUnit.SECONDS);
        log.info("{} Scheduled every {} keeping {} days", LOG_PREFIX, interval, retention.getDays());
    }

    @PreDestroy
    public void shutdown() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Runs one cleanup pass.
     *
     * @return the cleanup result, or {@code null} if the pass failed
     */
    public CleanupResult runCleanup() {
        try {
            CleanupResult result = historyManager.cleanupOlderThan(properties.getRetention().getDays(), false);
            log.info("{} Removed {} records older than {}", LOG_PREFIX, result.getCleanedRecords(),
                    result.getCutoffDate());
            return result;
        } catch (Exception e) { // NOSONAR - keep the schedule alive
            log.error("{} Cleanup failed", LOG_PREFIX, e);
            return null;
        }
    }

    boolean isScheduled() {
        return scheduler != null;
    }
}
