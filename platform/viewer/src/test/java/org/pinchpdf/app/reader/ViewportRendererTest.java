package org.pinchpdf.app.reader;

import org.junit.Before;
import org.junit.Test;
import org.pinchpdf.app.testing.FakePdf;
import org.pinchpdf.app.testing.ManualRenderTimer;
import org.pinchpdf.core.RenderMode;

import java.awt.Color;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.junit.Assert.*;

public class ViewportRendererTest {

    private ManualRenderTimer timer;
    private Deque<Runnable> uiQueue;
    private List<BufferedImage> frames;
    private ViewportRenderer renderer;
    private FakePdf.Page page;

    @Before
    public void setUp() {
        timer = new ManualRenderTimer();
        uiQueue = new ArrayDeque<>();
        frames = new ArrayList<>();
        renderer = new ViewportRenderer(timer, 50L, uiQueue::add, 1f, 10f);
        renderer.setFrameListener(frames::add);
        page = new FakePdf.Page(0, 200, 300);
    }

    private void settle() {
        timer.runPending();
        while (!uiQueue.isEmpty()) uiQueue.poll().run();
    }

    @Test
    public void nothingIsScheduledWithoutPageOrSize() {
        renderer.requestRender();
        renderer.onSizeChanged(400, 600);
        assertEquals(0, timer.scheduledCount());

        ViewportRenderer sized = new ViewportRenderer(timer, 50L, Runnable::run, 1f, 10f);
        sized.showPage(page);
        assertEquals(0, timer.scheduledCount());
        sized.onSizeChanged(0, 600);
        assertEquals(0, timer.scheduledCount());
    }

    @Test
    public void fitWidthFrameMatchesViewSize() {
        renderer.showPage(page);
        renderer.onSizeChanged(400, 600);
        settle();

        assertEquals(1, page.renderCount());
        assertEquals(RenderMode.FOR_DISPLAY, page.modes.get(0));
        AffineTransform m = page.transforms.get(0);
        assertEquals(2d, m.getScaleX(), 1e-6);
        assertEquals(2d, m.getScaleY(), 1e-6);
        assertEquals(0d, m.getTranslateX(), 1e-6);

        assertEquals(1, frames.size());
        BufferedImage frame = frames.get(0);
        assertEquals(400, frame.getWidth());
        assertEquals(600, frame.getHeight());
        assertEquals(0xFFFFFFFF, frame.getRGB(10, 10));
        assertSame(frame, renderer.getFrame());
    }

    @Test
    public void gestureBurstRendersOnlyFinalState() {
        renderer.showPage(page);
        renderer.onSizeChanged(400, 600);
        renderer.onScale(1.5f, 200f, 300f);
        renderer.onScale(1.2f, 200f, 300f);
        renderer.onScroll(10f, 10f);

        assertEquals(1, timer.pendingCount());
        settle();

        assertEquals(1, page.renderCount());
        AffineTransform m = page.transforms.get(0);
        float zoom = renderer.getZoom();
        assertEquals(1.8f, zoom, 1e-4f);
        assertEquals(2d * zoom, m.getScaleX(), 1e-4);
        assertEquals(renderer.getPanX(), m.getTranslateX(), 1e-4);
        assertEquals(renderer.getPanY(), m.getTranslateY(), 1e-4);
        assertTrue(renderer.getPanX() < 0f);
    }

    @Test
    public void deepZoomKeepsViewSizedOutput() {
        renderer.showPage(page);
        renderer.onSizeChanged(400, 600);
        renderer.onScale(50f, 0f, 0f);
        settle();

        assertEquals(10f, renderer.getZoom(), 0f);
        BufferedImage target = page.targets.get(0);
        assertEquals(400, target.getWidth());
        assertEquals(600, target.getHeight());
        assertEquals(20d, page.transforms.get(0).getScaleX(), 1e-4);
    }

    @Test
    public void successiveRendersAlternateBuffers() {
        renderer.showPage(page);
        renderer.onSizeChanged(400, 600);
        settle();
        renderer.onScale(2f, 0f, 0f);
        settle();

        assertEquals(2, frames.size());
        assertNotSame(frames.get(0), frames.get(1));
    }

    @Test
    public void showPageResetsViewport() {
        renderer.showPage(page);
        renderer.onSizeChanged(400, 600);
        renderer.onScale(3f, 100f, 100f);
        settle();

        FakePdf.Page next = new FakePdf.Page(1, 200, 300);
        renderer.showPage(next);
        assertEquals(1f, renderer.getZoom(), 0f);
        assertEquals(0f, renderer.getPanX(), 0f);
        assertEquals(0f, renderer.getPanY(), 0f);
        settle();
        assertEquals(1, next.renderCount());
    }

    @Test
    public void frameOfReplacedPageIsNotPublished() {
        renderer.showPage(page);
        renderer.onSizeChanged(400, 600);
        timer.runPending();
        renderer.showPage(new FakePdf.Page(1, 200, 300));
        while (!uiQueue.isEmpty()) uiQueue.poll().run();

        assertTrue(frames.isEmpty());
        assertNull(renderer.getFrame());
    }

    @Test
    public void failedRenderKeepsPreviousFrame() {
        renderer.showPage(page);
        renderer.onSizeChanged(400, 600);
        settle();
        BufferedImage first = renderer.getFrame();

        page.failWith(new IOException("damaged content stream"));
        renderer.onScale(2f, 0f, 0f);
        settle();

        assertEquals(1, frames.size());
        assertSame(first, renderer.getFrame());

        page.failWith(null);
        renderer.onScroll(5f, 5f);
        settle();
        assertEquals(2, frames.size());
    }

    @Test
    public void repeatedFailuresNeverTouchDisplayedPixels() {
        page.paintWith(Color.BLACK);
        renderer.showPage(page);
        renderer.onSizeChanged(400, 600);
        settle();
        BufferedImage shown = renderer.getFrame();
        assertEquals(0xFF000000, shown.getRGB(200, 300));

        page.failWith(new IOException("damaged content stream"));
        renderer.onScale(2f, 0f, 0f);
        settle();
        BufferedImage firstFailedTarget = lastRenderTarget();
        renderer.onScale(1.5f, 0f, 0f);
        settle();

        assertNotSame(shown, firstFailedTarget);
        assertNotSame(shown, lastRenderTarget());
        assertSame(shown, renderer.getFrame());
        assertEquals(0xFF000000, shown.getRGB(200, 300));
        assertEquals(1, frames.size());
    }

    @Test
    public void queuedFrameIsDroppedWhenItsBufferIsReused() {
        page.paintWith(Color.BLACK);
        renderer.showPage(page);
        renderer.onSizeChanged(400, 600);
        settle();
        BufferedImage shown = renderer.getFrame();

        page.paintWith(Color.BLUE);
        renderer.onScale(2f, 0f, 0f);
        timer.runPending();
        assertEquals(1, uiQueue.size());

        page.failWith(new IOException("damaged content stream"));
        renderer.onScale(1.5f, 0f, 0f);
        timer.runPending();
        while (!uiQueue.isEmpty()) uiQueue.poll().run();

        assertSame(shown, renderer.getFrame());
        assertEquals(0xFF000000, shown.getRGB(200, 300));
        assertEquals(1, frames.size());
    }

    private BufferedImage lastRenderTarget() {
        return page.attemptedTargets.get(page.attemptedTargets.size() - 1);
    }

    @Test
    public void releaseCancelsPendingRenderAndReturnsPage() {
        renderer.showPage(page);
        renderer.onSizeChanged(400, 600);
        assertSame(page, renderer.release());

        assertEquals(0, timer.runPending());
        assertEquals(0, page.renderCount());
        assertNull(renderer.getPage());
        assertNull(renderer.release());
    }

    @Test
    public void resetViewportReturnsToFitWidth() {
        renderer.showPage(page);
        renderer.onSizeChanged(400, 600);
        renderer.onScale(4f, 50f, 50f);
        renderer.resetViewport();
        assertEquals(1f, renderer.getZoom(), 0f);
        assertTrue(renderer.hasPendingRender());
    }
}
