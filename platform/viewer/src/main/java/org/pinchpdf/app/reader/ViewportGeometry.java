package org.pinchpdf.app.reader;

import java.awt.geom.AffineTransform;

/**
 * Pure geometry for the viewport renderer, kept free of toolkit types so it stays testable.
 * Page sizes are in points, view sizes and offsets in pixels.
 */
public final class ViewportGeometry {
    private ViewportGeometry() {}

    /** Scale that fits the page width to the view width. */
    public static float fitWidthScale(int viewWidth, int pageWidth) {
        if (pageWidth <= 0) return 1f;
        return (float) viewWidth / (float) pageWidth;
    }

    public static float totalScale(int viewWidth, int pageWidth, float zoom) {
        return fitWidthScale(viewWidth, pageWidth) * zoom;
    }

    /**
     * Page-to-view matrix: scale by fit-width times zoom, then translate by the pan offset.
     */
    public static AffineTransform pageToView(int viewWidth, int pageWidth,
                                             float zoom, float panX, float panY) {
        float scale = totalScale(viewWidth, pageWidth, zoom);
        AffineTransform matrix = new AffineTransform();
        matrix.translate(panX, panY);
        matrix.scale(scale, scale);
        return matrix;
    }

    /**
     * Allowed pan range along one axis as {min, max}. Content larger than the view may scroll
     * until its far edge meets the view edge; smaller content may move within the view.
     */
    public static float[] panBounds(float viewExtent, float contentExtent) {
        float slack = viewExtent - contentExtent;
        return new float[]{Math.min(0f, slack), Math.max(0f, slack)};
    }

    public static float clampPan(float pan, float viewExtent, float contentExtent) {
        float[] bounds = panBounds(viewExtent, contentExtent);
        return Math.min(Math.max(pan, bounds[0]), bounds[1]);
    }
}
