package org.pinchpdf.app.reader;

/**
 * Delayed task source for render debouncing. Tasks run on the timer's own render thread.
 */
public interface RenderTimer {

    interface Cancellable {
        /** Prevents the task from starting; has no effect once it has started. */
        void cancel();
    }

    Cancellable schedule(Runnable task, long delayMs);

    void shutdown();
}
