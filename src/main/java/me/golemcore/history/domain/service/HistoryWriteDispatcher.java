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

import me.golemcore.history.infrastructure.config.HistoryProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs history writes off the caller's thread.
 *
 * <p>
 * A single daemon worker drains a bounded queue, so writes keep their
 * submission order. Submitting never blocks: when the queue is full the write is
 * dropped and logged. Pending writes are drained on shutdown, bounded by
 * {@code history.writer.shutdown-timeout}.
 */
@Component
@Slf4j
public class HistoryWriteDispatcher {

    private static final String LOG_PREFIX = "[HistoryWriter]";
    private static final long FLUSH_POLL_MILLIS = 5;

    private final ThreadPoolExecutor executor;
    private final Duration shutdownTimeout;
    private final AtomicInteger pending = new AtomicInteger();
    private final AtomicLong dropped = new AtomicLong();

    public HistoryWriteDispatcher(HistoryProperties properties) {
        HistoryProperties.WriterProperties writer = properties.getWriter();
        int capacity = Math.max(1, writer.getQueueCapacity());
        this.shutdownTimeout = writer.getShutdownTimeout() != null ? writer.getShutdownTimeout()
                : Duration.ofSeconds(5);
        this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(capacity), r -> {
                    Thread t = new Thread(r, "history-writer");
                    t.setDaemon(true);
                    return t;
                }, new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Queues a write.
     *
     * @return {@code false} if the write was dropped because the queue is full or
     *         the dispatcher is shut down
     */
    public boolean submit(String description, Runnable write) {
        pending.incrementAndGet();
        try {
            executor.execute(() -> {
                try {
                    write.run();
                } catch (RuntimeException e) { // NOSONAR - keep the worker alive
                    log.warn("{} Write failed ({}): {}", LOG_PREFIX, description, e.getMessage());
                } finally {
                    pending.decrementAndGet();
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            pending.decrementAndGet();
            long total = dropped.incrementAndGet();
            log.warn("{} Dropped write ({}), queue full or closed, {} dropped so far", LOG_PREFIX,
                    description, total);
            return false;
        }
    }

    /**
     * Waits until every queued write has run.
     *
     * @return {@code true} if the queue drained within the timeout
     */
    public boolean flush(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (pending.get() > 0) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(FLUSH_POLL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    public int getPendingCount() {
        return pending.get();
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                int lost = executor.shutdownNow().size();
                log.warn("{} Shutdown timed out, {} writes not persisted", LOG_PREFIX, lost);
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
