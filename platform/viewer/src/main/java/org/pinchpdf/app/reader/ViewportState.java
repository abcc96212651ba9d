package org.pinchpdf.app.reader;

/**
 * Zoom and pan of one viewport. Not thread-safe; {@link ViewportRenderer} guards it.
 */
public final class ViewportState {
    private final float minZoom;
    private final float maxZoom;

    private float zoom = 1f;
    private float panX = 0f;
    private float panY = 0f;

    public ViewportState(float minZoom, float maxZoom) {
        if (minZoom <= 0f || maxZoom < minZoom) {
            throw new IllegalArgumentException("Invalid zoom range [" + minZoom + ", " + maxZoom + "]");
        }
        this.minZoom = minZoom;
        this.maxZoom = maxZoom;
        this.zoom = ZoomController.clamp(1f, minZoom, maxZoom);
    }

    public float getZoom() { return zoom; }
    public float getPanX() { return panX; }
    public float getPanY() { return panY; }
    public float getMinZoom() { return minZoom; }
    public float getMaxZoom() { return maxZoom; }

    public void reset() {
        zoom = ZoomController.clamp(1f, minZoom, maxZoom);
        panX = 0f;
        panY = 0f;
    }

    /**
     * Applies a pinch step around a focus point and clamps the result.
     *
     * @return true if zoom or pan changed
     */
    public boolean applyScale(float factor, float focusX, float focusY,
                              int viewWidth, int viewHeight, int pageWidth, int pageHeight) {
        float newZoom = ZoomController.clampScale(zoom, factor, minZoom, maxZoom);
        float[] pan = ZoomController.computePanForScale(zoom, newZoom, panX, panY, focusX, focusY);
        return set(newZoom, pan[0], pan[1], viewWidth, viewHeight, pageWidth, pageHeight);
    }

    /**
     * Moves the content by the negative scroll distance, as a drag does.
     *
     * @return true if the pan changed
     */
    public boolean applyScroll(float distanceX, float distanceY,
                               int viewWidth, int viewHeight, int pageWidth, int pageHeight) {
        return set(zoom, panX - distanceX, panY - distanceY, viewWidth, viewHeight, pageWidth, pageHeight);
    }

    /** Re-clamps the pan after a view or page size change. */
    public boolean clampTo(int viewWidth, int viewHeight, int pageWidth, int pageHeight) {
        return set(zoom, panX, panY, viewWidth, viewHeight, pageWidth, pageHeight);
    }

    private boolean set(float newZoom, float newPanX, float newPanY,
                        int viewWidth, int viewHeight, int pageWidth, int pageHeight) {
        float scale = ViewportGeometry.totalScale(viewWidth, pageWidth, newZoom);
        newPanX = ViewportGeometry.clampPan(newPanX, viewWidth, pageWidth * scale);
        newPanY = ViewportGeometry.clampPan(newPanY, viewHeight, pageHeight * scale);
        boolean changed = newZoom != zoom || newPanX != panX || newPanY != panY;
        zoom = newZoom;
        panX = newPanX;
        panY = newPanY;
        return changed;
    }
}
