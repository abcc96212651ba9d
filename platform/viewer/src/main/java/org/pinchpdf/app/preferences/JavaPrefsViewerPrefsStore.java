package org.pinchpdf.app.preferences;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

/**
 * {@link Preferences}-backed viewer prefs store. A {@code pinchpdf.<key>} entry in the override
 * properties (the system properties by default) wins over the stored value.
 */
public final class JavaPrefsViewerPrefsStore implements ViewerPrefsStore {
    private static final Logger LOG = LoggerFactory.getLogger(JavaPrefsViewerPrefsStore.class);

    private final Preferences prefs;
    private final Properties overrides;

    public JavaPrefsViewerPrefsStore(Preferences prefs, Properties overrides) {
        if (prefs == null) throw new IllegalArgumentException("prefs == null");
        this.prefs = prefs;
        this.overrides = overrides != null ? overrides : new Properties();
    }

    public static JavaPrefsViewerPrefsStore forCurrentUser() {
        return new JavaPrefsViewerPrefsStore(
                Preferences.userRoot().node(PreferencesNames.NODE), System.getProperties());
    }

    @Override
    public ViewerPrefsSnapshot load() {
        long debounce = getLong(PreferencesNames.RENDER_DEBOUNCE_MS, ViewerPrefsSnapshot.DEFAULT_RENDER_DEBOUNCE_MS);
        if (debounce < 0) {
            LOG.warn("Ignoring negative {}={}", PreferencesNames.RENDER_DEBOUNCE_MS, debounce);
            debounce = ViewerPrefsSnapshot.DEFAULT_RENDER_DEBOUNCE_MS;
        }

        float minZoom = getFloat(PreferencesNames.VIEWPORT_MIN_ZOOM, ViewerPrefsSnapshot.DEFAULT_VIEWPORT_MIN_ZOOM);
        float maxZoom = getFloat(PreferencesNames.VIEWPORT_MAX_ZOOM, ViewerPrefsSnapshot.DEFAULT_VIEWPORT_MAX_ZOOM);
        if (!(minZoom > 0f) || !(maxZoom >= minZoom)) {
            LOG.warn("Ignoring invalid viewport zoom range [{}, {}]", minZoom, maxZoom);
            minZoom = ViewerPrefsSnapshot.DEFAULT_VIEWPORT_MIN_ZOOM;
            maxZoom = ViewerPrefsSnapshot.DEFAULT_VIEWPORT_MAX_ZOOM;
        }

        int width = getInt(PreferencesNames.RENDER_WIDTH, ViewerPrefsSnapshot.DEFAULT_RENDER_WIDTH);
        int height = getInt(PreferencesNames.RENDER_HEIGHT, ViewerPrefsSnapshot.DEFAULT_RENDER_HEIGHT);
        if (width <= 0 || height <= 0) {
            LOG.warn("Ignoring invalid render size {}x{}", width, height);
            width = ViewerPrefsSnapshot.DEFAULT_RENDER_WIDTH;
            height = ViewerPrefsSnapshot.DEFAULT_RENDER_HEIGHT;
        }

        boolean vectorMode = Boolean.parseBoolean(
                get(PreferencesNames.START_IN_VECTOR_MODE, Boolean.FALSE.toString()));
        String lastDirectory = get(PreferencesNames.LAST_DIRECTORY, null);

        return new ViewerPrefsSnapshot(debounce, minZoom, maxZoom, width, height, vectorMode, lastDirectory);
    }

    @Override
    public void saveLastDirectory(String directory) {
        if (directory == null) return;
        prefs.put(PreferencesNames.LAST_DIRECTORY, directory);
        try {
            prefs.flush();
        } catch (BackingStoreException e) {
            LOG.warn("Failed to persist {}", PreferencesNames.LAST_DIRECTORY, e);
        }
    }

    private String get(String key, String def) {
        String override = overrides.getProperty(PreferencesNames.SYSTEM_PROPERTY_PREFIX + key);
        if (override != null) return override.trim();
        return prefs.get(key, def);
    }

    private long getLong(String key, long def) {
        String raw = get(key, null);
        if (raw == null) return def;
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring malformed {}={}", key, raw);
            return def;
        }
    }

    private int getInt(String key, int def) {
        String raw = get(key, null);
        if (raw == null) return def;
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring malformed {}={}", key, raw);
            return def;
        }
    }

    private float getFloat(String key, float def) {
        String raw = get(key, null);
        if (raw == null) return def;
        try {
            return Float.parseFloat(raw);
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring malformed {}={}", key, raw);
            return def;
        }
    }
}
