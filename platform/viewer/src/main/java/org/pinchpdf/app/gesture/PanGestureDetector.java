package org.pinchpdf.app.gesture;

import java.awt.event.MouseAdapter;
import java.awt.event.MouseEvent;
import java.awt.event.MouseWheelEvent;

import javax.swing.SwingUtilities;

/**
 * Turns drags into scroll callbacks and double clicks into double taps. Scroll distances follow
 * the touch convention: previous position minus current position.
 */
public final class PanGestureDetector extends MouseAdapter {

    /** Pixels scrolled per plain wheel notch. */
    public static final float WHEEL_SCROLL_STEP = 40f;

    public interface OnGestureListener {
        boolean onScroll(float distanceX, float distanceY);

        boolean onDoubleTap(float x, float y);
    }

    private final OnGestureListener listener;
    private boolean dragging;
    private float lastX;
    private float lastY;

    public PanGestureDetector(OnGestureListener listener) {
        if (listener == null) throw new IllegalArgumentException("listener == null");
        this.listener = listener;
    }

    public void onDown(float x, float y) {
        dragging = true;
        lastX = x;
        lastY = y;
    }

    /** @return true if a scroll was delivered */
    public boolean onMove(float x, float y) {
        if (!dragging) return false;
        float dx = lastX - x;
        float dy = lastY - y;
        lastX = x;
        lastY = y;
        if (dx == 0f && dy == 0f) return false;
        return listener.onScroll(dx, dy);
    }

    public void onUp() {
        dragging = false;
    }

    public boolean onWheelScroll(double rotation, boolean horizontal) {
        if (rotation == 0d) return false;
        float distance = (float) (rotation * WHEEL_SCROLL_STEP);
        return horizontal ? listener.onScroll(distance, 0f) : listener.onScroll(0f, distance);
    }

    public boolean isDragging() {
        return dragging;
    }

    @Override
    public void mousePressed(MouseEvent e) {
        if (SwingUtilities.isLeftMouseButton(e)) onDown(e.getX(), e.getY());
    }

    @Override
    public void mouseDragged(MouseEvent e) {
        onMove(e.getX(), e.getY());
    }

    @Override
    public void mouseReleased(MouseEvent e) {
        if (SwingUtilities.isLeftMouseButton(e)) onUp();
    }

    @Override
    public void mouseClicked(MouseEvent e) {
        if (SwingUtilities.isLeftMouseButton(e) && e.getClickCount() == 2) {
            listener.onDoubleTap(e.getX(), e.getY());
        }
    }

    @Override
    public void mouseWheelMoved(MouseWheelEvent e) {
        if (e.isControlDown()) return;
        onWheelScroll(e.getPreciseWheelRotation(), e.isShiftDown());
    }
}
