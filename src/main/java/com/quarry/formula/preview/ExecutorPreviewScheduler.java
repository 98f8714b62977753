package com.quarry.formula.preview;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/** {@link PreviewScheduler} on a {@link ScheduledExecutorService}. */
public final class ExecutorPreviewScheduler implements PreviewScheduler, AutoCloseable {

    private static final AtomicInteger THREADS = new AtomicInteger();

    private final ScheduledExecutorService executor;
    private final boolean owned;

    /** Uses a private single daemon thread, shut down by {@link #close()}. */
    public ExecutorPreviewScheduler() {
        this(Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "formula-preview-" + THREADS.incrementAndGet());
            t.setDaemon(true);
            return t;
        }), true);
    }

    /** Uses the host's executor; {@link #close()} leaves it running. */
    public ExecutorPreviewScheduler(ScheduledExecutorService executor) {
        this(executor, false);
    }

    private ExecutorPreviewScheduler(ScheduledExecutorService executor, boolean owned) {
        if (executor == null) throw new IllegalArgumentException("executor must not be null");
        this.executor = executor;
        this.owned = owned;
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        long nanos = (delay == null || delay.isNegative()) ? 0 : delay.toNanos();
        ScheduledFuture<?> f = executor.schedule(task, nanos, TimeUnit.NANOSECONDS);
        return () -> f.cancel(false);
    }

    @Override
    public void close() {
        if (owned) executor.shutdownNow();
    }
}
