package org.pinchpdf.app.reader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps at most one pending render: each request cancels the pending one and schedules a fresh
 * run after the debounce delay, so a burst of gesture updates yields a single render of the
 * final state.
 */
public final class DebouncedRenderScheduler {
    private static final Logger LOG = LoggerFactory.getLogger(DebouncedRenderScheduler.class);

    public static final long DEFAULT_DELAY_MS = 50L;

    private final RenderTimer timer;
    private final long delayMs;
    private final Runnable task;

    private RenderTimer.Cancellable pending;
    // Bumped on every request and cancel; a run whose generation is stale was superseded.
    private long generation;

    public DebouncedRenderScheduler(RenderTimer timer, long delayMs, Runnable task) {
        if (timer == null) throw new IllegalArgumentException("timer == null");
        if (task == null) throw new IllegalArgumentException("task == null");
        this.timer = timer;
        this.delayMs = Math.max(0L, delayMs);
        this.task = task;
    }

    public synchronized void requestRender() {
        if (pending != null) pending.cancel();
        final long scheduled = ++generation;
        pending = timer.schedule(() -> run(scheduled), delayMs);
    }

    public synchronized void cancel() {
        if (pending != null) pending.cancel();
        pending = null;
        generation++;
    }

    public synchronized boolean hasPending() {
        return pending != null;
    }

    public long getDelayMs() {
        return delayMs;
    }

    private void run(long scheduled) {
        synchronized (this) {
            if (scheduled != generation) return;
            pending = null;
        }
        try {
            task.run();
        } catch (RuntimeException e) {
            LOG.error("Render task failed", e);
        }
    }
}
