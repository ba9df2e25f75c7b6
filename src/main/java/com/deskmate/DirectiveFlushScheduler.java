package com.deskmate;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Drains the orchestrator's pending directives at a fixed cadence on the animation thread.
 */
public class DirectiveFlushScheduler {

    public static final long DEFAULT_INTERVAL_MS = 500;
    private static final String COMPONENT = "DirectiveFlushScheduler";

    private final ChatOrchestrator orchestrator;
    private final ScheduledExecutorService executor;
    private final long intervalMs;
    private ScheduledFuture<?> future;
    private volatile long lastRunAt = 0L;
    private volatile long flushedTotal = 0L;

    public DirectiveFlushScheduler(ChatOrchestrator orchestrator, ScheduledExecutorService animationExecutor,
                                   long intervalMs) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.executor = Objects.requireNonNull(animationExecutor, "animationExecutor");
        this.intervalMs = intervalMs > 0 ? intervalMs : DEFAULT_INTERVAL_MS;
    }

    public synchronized void start() {
        if (future != null) {
            return;
        }
        future = executor.scheduleAtFixedRate(this::runOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        AppLogger.info(COMPONENT, "Flushing pending directives every " + intervalMs + " ms");
    }

    public synchronized void stop() {
        if (future != null) {
            future.cancel(false);
            future = null;
        }
    }

    void runOnce() {
        try {
            int flushed = orchestrator.flushPending();
            lastRunAt = System.currentTimeMillis();
            flushedTotal += flushed;
        } catch (Exception e) {
            AppLogger.warn(COMPONENT, "Directive flush failed: " + e.getMessage());
        }
    }

    public long getLastRunAt() {
        return lastRunAt;
    }

    public long getFlushedTotal() {
        return flushedTotal;
    }

    /**
     * The single thread that owns the animation backend.
     */
    public static ScheduledExecutorService newAnimationExecutor() {
        return Executors.newSingleThreadScheduledExecutor(animationThreadFactory());
    }

    private static ThreadFactory animationThreadFactory() {
        return r -> {
            Thread t = new Thread(r, "animation-loop");
            t.setDaemon(true);
            return t;
        };
    }
}
