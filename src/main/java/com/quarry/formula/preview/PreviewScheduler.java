package com.quarry.formula.preview;

import java.time.Duration;

/** Runs a task once after a delay. The live-preview debounce timer is built on this. */
public interface PreviewScheduler {

    ScheduledTask schedule(Runnable task, Duration delay);

    interface ScheduledTask {
        /** Prevents the task from running if it has not started. Idempotent. */
        void cancel();
    }
}
