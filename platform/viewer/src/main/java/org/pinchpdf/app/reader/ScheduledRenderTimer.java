package org.pinchpdf.app.reader;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link RenderTimer} on a single daemon thread, which also serializes the renders it runs.
 */
public final class ScheduledRenderTimer implements RenderTimer {
    private static final AtomicInteger THREAD_IDS = new AtomicInteger();

    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "viewport-render-" + THREAD_IDS.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    @Override
    public Cancellable schedule(Runnable task, long delayMs) {
        ScheduledFuture<?> future = executor.schedule(task, Math.max(0L, delayMs), TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public void shutdown() {
        executor.shutdownNow();
    }
}
