package org.pinchpdf.app.preferences;

/** Preference node path and keys. */
public final class PreferencesNames {
    private PreferencesNames() {}

    /** Node under the user preference root. */
    public static final String NODE = "org/pinchpdf/viewer";

    /** Prefix for system property overrides, e.g. {@code -Dpinchpdf.renderDebounceMs=80}. */
    public static final String SYSTEM_PROPERTY_PREFIX = "pinchpdf.";

    public static final String RENDER_DEBOUNCE_MS = "renderDebounceMs";
    public static final String VIEWPORT_MIN_ZOOM = "viewportMinZoom";
    public static final String VIEWPORT_MAX_ZOOM = "viewportMaxZoom";
    public static final String RENDER_WIDTH = "renderWidth";
    public static final String RENDER_HEIGHT = "renderHeight";
    public static final String START_IN_VECTOR_MODE = "startInVectorMode";
    public static final String LAST_DIRECTORY = "lastDirectory";
}
