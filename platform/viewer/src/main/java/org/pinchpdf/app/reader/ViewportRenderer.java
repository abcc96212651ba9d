package org.pinchpdf.app.reader;

import org.pinchpdf.app.util.Bitmaps;
import org.pinchpdf.core.PdfPageHandle;
import org.pinchpdf.core.RenderMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.concurrent.Executor;

import javax.annotation.Nullable;

/**
 * Renders only the visible viewport of one page at the current zoom and pan.
 * <p>
 * The output is a bitmap the size of the view; deep zoom re-rasterizes the visible region
 * through a transform instead of scaling a full-page bitmap. Gesture updates go through a
 * {@link DebouncedRenderScheduler}, so continuous motion renders only its settled state.
 * Frames are delivered on the UI executor.
 */
public final class ViewportRenderer {
    private static final Logger LOG = LoggerFactory.getLogger(ViewportRenderer.class);

    public static final float DEFAULT_MIN_ZOOM = 1f;
    public static final float DEFAULT_MAX_ZOOM = 10f;

    public interface FrameListener {
        FrameListener NOOP = frame -> {};

        /** Called on the UI executor with a freshly rendered frame. */
        void onFrameReady(BufferedImage frame);
    }

    private final Object lock = new Object();
    private final Executor uiExecutor;
    private final DebouncedRenderScheduler scheduler;
    private final RenderBitmapPool pool = new RenderBitmapPool();
    private final ViewportState state;

    private volatile FrameListener frameListener = FrameListener.NOOP;

    // Guarded by lock.
    @Nullable private PdfPageHandle page;
    private int viewWidth;
    private int viewHeight;
    @Nullable private BufferedImage frame;
    // Rendered and queued on the UI executor, not yet shown.
    @Nullable private BufferedImage pendingFrame;

    public ViewportRenderer(RenderTimer timer, long debounceMs, Executor uiExecutor,
                            float minZoom, float maxZoom) {
        if (uiExecutor == null) throw new IllegalArgumentException("uiExecutor == null");
        this.uiExecutor = uiExecutor;
        this.state = new ViewportState(minZoom, maxZoom);
        this.scheduler = new DebouncedRenderScheduler(timer, debounceMs, this::renderNow);
    }

    public void setFrameListener(@Nullable FrameListener listener) {
        frameListener = listener != null ? listener : FrameListener.NOOP;
    }

    /**
     * Displays {@code page}, which must be open. Resets zoom to 1 and pan to the origin.
     */
    public void showPage(PdfPageHandle page) {
        if (page == null) throw new IllegalArgumentException("page == null");
        synchronized (lock) {
            this.page = page;
            state.reset();
        }
        requestRender();
    }

    public void onSizeChanged(int width, int height) {
        if (width <= 0 || height <= 0) return;
        synchronized (lock) {
            viewWidth = width;
            viewHeight = height;
            if (page != null) state.clampTo(width, height, page.getWidth(), page.getHeight());
        }
        requestRender();
    }

    public void onScale(float scaleFactor, float focusX, float focusY) {
        boolean changed;
        synchronized (lock) {
            if (page == null || viewWidth == 0) return;
            changed = state.applyScale(scaleFactor, focusX, focusY,
                    viewWidth, viewHeight, page.getWidth(), page.getHeight());
        }
        if (changed) requestRender();
    }

    public void onScroll(float distanceX, float distanceY) {
        boolean changed;
        synchronized (lock) {
            if (page == null || viewWidth == 0) return;
            changed = state.applyScroll(distanceX, distanceY,
                    viewWidth, viewHeight, page.getWidth(), page.getHeight());
        }
        if (changed) requestRender();
    }

    /** Returns to the fit-width view. */
    public void resetViewport() {
        synchronized (lock) {
            if (page == null) return;
            state.reset();
        }
        requestRender();
    }

    /** Cancels any pending render and schedules one after the debounce delay. */
    public void requestRender() {
        synchronized (lock) {
            if (page == null || viewWidth == 0 || viewHeight == 0) return;
        }
        scheduler.requestRender();
    }

    /**
     * Stops pending work and detaches the current page, which is returned so the owner can
     * close it.
     */
    @Nullable
    public PdfPageHandle release() {
        scheduler.cancel();
        synchronized (lock) {
            PdfPageHandle detached = page;
            page = null;
            frame = null;
            pendingFrame = null;
            pool.clear();
            return detached;
        }
    }

    @Nullable
    public BufferedImage getFrame() {
        synchronized (lock) {
            return frame;
        }
    }

    @Nullable
    public PdfPageHandle getPage() {
        synchronized (lock) {
            return page;
        }
    }

    public float getZoom() {
        synchronized (lock) {
            return state.getZoom();
        }
    }

    public float getPanX() {
        synchronized (lock) {
            return state.getPanX();
        }
    }

    public float getPanY() {
        synchronized (lock) {
            return state.getPanY();
        }
    }

    public boolean hasPendingRender() {
        return scheduler.hasPending();
    }

    void renderNow() {
        final PdfPageHandle target;
        final BufferedImage bitmap;
        final AffineTransform matrix;
        synchronized (lock) {
            target = page;
            if (target == null || viewWidth == 0 || viewHeight == 0) return;
            matrix = ViewportGeometry.pageToView(viewWidth, target.getWidth(),
                    state.getZoom(), state.getPanX(), state.getPanY());
            bitmap = pool.next(frame, viewWidth, viewHeight);
            // A queued publish of this buffer is superseded before it is overwritten.
            if (pendingFrame == bitmap) pendingFrame = null;
        }

        try {
            Bitmaps.eraseColor(bitmap, Color.WHITE);
            target.render(bitmap, null, matrix, RenderMode.FOR_DISPLAY);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Viewport render of page {} failed", target.getIndex(), e);
            return;
        }

        synchronized (lock) {
            if (page != target) return;
            pendingFrame = bitmap;
        }
        uiExecutor.execute(() -> {
            synchronized (lock) {
                if (page != target || pendingFrame != bitmap) return;
                pendingFrame = null;
                frame = bitmap;
            }
            frameListener.onFrameReady(bitmap);
        });
    }
}
