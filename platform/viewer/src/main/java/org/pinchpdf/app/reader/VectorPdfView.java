package org.pinchpdf.app.reader;

import org.pinchpdf.app.gesture.PanGestureDetector;
import org.pinchpdf.app.gesture.ScaleGestureDetector;
import org.pinchpdf.core.PdfPageHandle;

import java.awt.Color;
import java.awt.Dimension;
import java.awt.Graphics;
import java.awt.event.ComponentAdapter;
import java.awt.event.ComponentEvent;
import java.awt.event.MouseWheelEvent;
import java.awt.image.BufferedImage;

import javax.annotation.Nullable;
import javax.swing.JComponent;
import javax.swing.SwingUtilities;

/**
 * Swing view that shows a {@link ViewportRenderer} frame and feeds it pinch and pan input.
 * The frame already contains the zoomed and translated content, so painting is a plain blit.
 * <p>
 * The view owns the page passed to {@link #showPage}: it closes it when another page replaces
 * it or on {@link #release()}.
 */
public class VectorPdfView extends JComponent {

    private final ViewportRenderer renderer;
    private final ScaleGestureDetector scaleDetector;
    private final PanGestureDetector panDetector;

    public VectorPdfView(RenderTimer timer, long debounceMs, float minZoom, float maxZoom) {
        this.renderer = new ViewportRenderer(timer, debounceMs, SwingUtilities::invokeLater, minZoom, maxZoom);
        this.renderer.setFrameListener(frame -> repaint());
        this.scaleDetector = new ScaleGestureDetector(new ScaleListener());
        this.panDetector = new PanGestureDetector(new GestureListener());

        setOpaque(true);
        setBackground(Color.LIGHT_GRAY);
        setPreferredSize(new Dimension(600, 800));

        addMouseListener(panDetector);
        addMouseMotionListener(panDetector);
        addMouseWheelListener(this::onMouseWheel);
        addComponentListener(new ComponentAdapter() {
            @Override
            public void componentResized(ComponentEvent e) {
                renderer.onSizeChanged(getWidth(), getHeight());
            }
        });
    }

    /** Call this to display a page. The page must be open. */
    public void showPage(PdfPageHandle page) {
        PdfPageHandle previous = renderer.getPage();
        renderer.showPage(page);
        if (previous != null && previous != page) previous.close();
    }

    public void release() {
        PdfPageHandle detached = renderer.release();
        if (detached != null) detached.close();
        repaint();
    }

    public float getZoom() {
        return renderer.getZoom();
    }

    @Nullable
    public PdfPageHandle getPage() {
        return renderer.getPage();
    }

    @Override
    protected void paintComponent(Graphics g) {
        g.setColor(getBackground());
        g.fillRect(0, 0, getWidth(), getHeight());
        BufferedImage frame = renderer.getFrame();
        if (frame != null) {
            g.drawImage(frame, 0, 0, null);
        }
    }

    private void onMouseWheel(MouseWheelEvent e) {
        if (!scaleDetector.onMouseWheel(e)) {
            panDetector.mouseWheelMoved(e);
        }
    }

    private final class ScaleListener implements ScaleGestureDetector.OnScaleGestureListener {
        @Override
        public boolean onScaleBegin(ScaleGestureDetector detector) {
            return renderer.getPage() != null;
        }

        @Override
        public boolean onScale(ScaleGestureDetector detector) {
            renderer.onScale(detector.getScaleFactor(), detector.getFocusX(), detector.getFocusY());
            return true;
        }

        @Override
        public void onScaleEnd(ScaleGestureDetector detector) {
        }
    }

    private final class GestureListener implements PanGestureDetector.OnGestureListener {
        @Override
        public boolean onScroll(float distanceX, float distanceY) {
            renderer.onScroll(distanceX, distanceY);
            return true;
        }

        @Override
        public boolean onDoubleTap(float x, float y) {
            renderer.resetViewport();
            return true;
        }
    }
}
