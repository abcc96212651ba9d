package org.pinchpdf.app.reader;

/**
 * Math utilities for pinch-zoom handling.
 */
public final class ZoomController {
    private ZoomController() {}

    public static float clampScale(float currentScale,
                                   float detectorScaleFactor,
                                   float minScale,
                                   float maxScale) {
        return clamp(currentScale * detectorScaleFactor, minScale, maxScale);
    }

    public static float clamp(float scale, float minScale, float maxScale) {
        if (scale < minScale) scale = minScale;
        if (scale > maxScale) scale = maxScale;
        return scale;
    }

    /**
     * Compute the pan offset that keeps the zoom focus under the same screen point.
     * Returns a float[2] of {newPanX, newPanY}.
     */
    public static float[] computePanForScale(float previousScale,
                                             float newScale,
                                             float panX,
                                             float panY,
                                             float focusX,
                                             float focusY) {
        if (previousScale <= 0f) return new float[]{panX, panY};
        float factor = newScale / previousScale;
        return new float[]{
                focusX - (focusX - panX) * factor,
                focusY - (focusY - panY) * factor
        };
    }
}
