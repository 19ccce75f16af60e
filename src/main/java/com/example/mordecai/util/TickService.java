package com.example.mordecai.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scheduler for the periodic background sweeps (health tick, effect tick).
 * Tasks are registered under a name so they can be cancelled individually;
 * each run is wrapped so one failing sweep never kills its schedule.
 */
public class TickService {

    private static final Logger logger = LoggerFactory.getLogger(TickService.class);

    private final ScheduledExecutorService scheduler;
    private final Map<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();

    public TickService() {
        this(2);
    }

    public TickService(int threads) {
        AtomicInteger counter = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "mordecai-tick-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Schedule a named task. Registering a name twice cancels the earlier task.
     */
    public ScheduledFuture<?> scheduleAtFixedRate(String name, Runnable task, long initialDelayMs, long periodMs) {
        Runnable guarded = () -> {
            if (Thread.currentThread().isInterrupted()) return;
            try {
                task.run();
            } catch (Throwable t) {
                logger.error("[TickService] task '{}' failed", name, t);
            }
        };
        ScheduledFuture<?> f = scheduler.scheduleAtFixedRate(guarded, initialDelayMs, periodMs, TimeUnit.MILLISECONDS);
        ScheduledFuture<?> previous = tasks.put(name, f);
        if (previous != null) {
            previous.cancel(false);
        }
        logger.debug("[TickService] scheduled '{}' every {}ms", name, periodMs);
        return f;
    }

    public boolean isScheduled(String name) {
        ScheduledFuture<?> f = tasks.get(name);
        return f != null && !f.isDone();
    }

    public boolean cancel(String name) {
        ScheduledFuture<?> f = tasks.remove(name);
        if (f == null) return false;
        return f.cancel(false);
    }

    public void shutdown() {
        for (Map.Entry<String, ScheduledFuture<?>> e : tasks.entrySet()) {
            e.getValue().cancel(false);
        }
        tasks.clear();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
