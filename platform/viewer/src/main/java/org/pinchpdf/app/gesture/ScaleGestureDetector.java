package org.pinchpdf.app.gesture;

import java.awt.event.MouseWheelEvent;

/**
 * Turns ctrl+wheel events into pinch callbacks. Trackpad pinches arrive from AWT as
 * ctrl+wheel events with fractional rotation, so both map to one scale step per event.
 */
public final class ScaleGestureDetector {

    /** Scale factor for one full wheel notch towards the user. */
    public static final double NOTCH_FACTOR = 1.1;

    public interface OnScaleGestureListener {
        boolean onScaleBegin(ScaleGestureDetector detector);

        boolean onScale(ScaleGestureDetector detector);

        void onScaleEnd(ScaleGestureDetector detector);
    }

    private final OnScaleGestureListener listener;
    private float scaleFactor = 1f;
    private float focusX;
    private float focusY;
    private boolean inProgress;

    public ScaleGestureDetector(OnScaleGestureListener listener) {
        if (listener == null) throw new IllegalArgumentException("listener == null");
        this.listener = listener;
    }

    /** @return true if the event was consumed as a scale gesture */
    public boolean onMouseWheel(MouseWheelEvent e) {
        if (!e.isControlDown()) return false;
        return onWheel(e.getPreciseWheelRotation(), e.getX(), e.getY());
    }

    /**
     * Feeds one wheel step. Negative rotation (away from the user) zooms in.
     *
     * @return true if the step was consumed as a scale gesture
     */
    public boolean onWheel(double rotation, float x, float y) {
        if (rotation == 0d || Double.isNaN(rotation)) return false;
        focusX = x;
        focusY = y;
        scaleFactor = (float) Math.pow(NOTCH_FACTOR, -rotation);
        if (!listener.onScaleBegin(this)) {
            scaleFactor = 1f;
            return false;
        }
        inProgress = true;
        try {
            listener.onScale(this);
        } finally {
            inProgress = false;
            listener.onScaleEnd(this);
        }
        return true;
    }

    public float getScaleFactor() { return scaleFactor; }
    public float getFocusX() { return focusX; }
    public float getFocusY() { return focusY; }
    public boolean isInProgress() { return inProgress; }
}
