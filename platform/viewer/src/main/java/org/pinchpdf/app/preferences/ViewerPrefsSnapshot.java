package org.pinchpdf.app.preferences;

import javax.annotation.Nullable;

/** Immutable snapshot of viewer preferences. */
public final class ViewerPrefsSnapshot {
    public static final long DEFAULT_RENDER_DEBOUNCE_MS = 50L;
    public static final float DEFAULT_VIEWPORT_MIN_ZOOM = 1f;
    public static final float DEFAULT_VIEWPORT_MAX_ZOOM = 10f;
    public static final int DEFAULT_RENDER_WIDTH = 1080;
    public static final int DEFAULT_RENDER_HEIGHT = 1440;

    public final long renderDebounceMs;
    public final float viewportMinZoom;
    public final float viewportMaxZoom;
    public final int renderWidth;
    public final int renderHeight;
    public final boolean startInVectorMode;
    @Nullable public final String lastDirectory;

    public ViewerPrefsSnapshot(long renderDebounceMs,
                               float viewportMinZoom,
                               float viewportMaxZoom,
                               int renderWidth,
                               int renderHeight,
                               boolean startInVectorMode,
                               @Nullable String lastDirectory) {
        this.renderDebounceMs = renderDebounceMs;
        this.viewportMinZoom = viewportMinZoom;
        this.viewportMaxZoom = viewportMaxZoom;
        this.renderWidth = renderWidth;
        this.renderHeight = renderHeight;
        this.startInVectorMode = startInVectorMode;
        this.lastDirectory = lastDirectory;
    }

    public static ViewerPrefsSnapshot defaults() {
        return new ViewerPrefsSnapshot(DEFAULT_RENDER_DEBOUNCE_MS,
                DEFAULT_VIEWPORT_MIN_ZOOM, DEFAULT_VIEWPORT_MAX_ZOOM,
                DEFAULT_RENDER_WIDTH, DEFAULT_RENDER_HEIGHT,
                false, null);
    }
}
