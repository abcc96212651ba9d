package org.pinchpdf.app.preferences;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.Properties;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

import static org.junit.Assert.*;

public class JavaPrefsViewerPrefsStoreTest {

    private Preferences node;
    private Properties overrides;
    private JavaPrefsViewerPrefsStore store;

    @Before
    public void setUp() {
        node = Preferences.userRoot().node("org/pinchpdf/test/prefs-" + System.nanoTime());
        overrides = new Properties();
        store = new JavaPrefsViewerPrefsStore(node, overrides);
    }

    @After
    public void tearDown() {
        try {
            node.removeNode();
        } catch (BackingStoreException ignore) {
            // Preferences directory may be read-only in CI; the node then only lived in memory.
        }
    }

    @Test
    public void emptyStoreYieldsDefaults() {
        ViewerPrefsSnapshot s = store.load();
        assertEquals(50L, s.renderDebounceMs);
        assertEquals(1f, s.viewportMinZoom, 0f);
        assertEquals(10f, s.viewportMaxZoom, 0f);
        assertEquals(1080, s.renderWidth);
        assertEquals(1440, s.renderHeight);
        assertFalse(s.startInVectorMode);
        assertNull(s.lastDirectory);
    }

    @Test
    public void storedValuesAreRead() {
        node.put(PreferencesNames.RENDER_DEBOUNCE_MS, "120");
        node.put(PreferencesNames.START_IN_VECTOR_MODE, "true");
        node.put(PreferencesNames.VIEWPORT_MAX_ZOOM, "16");
        ViewerPrefsSnapshot s = store.load();
        assertEquals(120L, s.renderDebounceMs);
        assertTrue(s.startInVectorMode);
        assertEquals(16f, s.viewportMaxZoom, 0f);
    }

    @Test
    public void overridesWinOverStoredValues() {
        node.put(PreferencesNames.RENDER_WIDTH, "800");
        overrides.setProperty("pinchpdf." + PreferencesNames.RENDER_WIDTH, " 640 ");
        assertEquals(640, store.load().renderWidth);
    }

    @Test
    public void invalidValuesFallBackToDefaults() {
        node.put(PreferencesNames.RENDER_DEBOUNCE_MS, "-3");
        node.put(PreferencesNames.RENDER_HEIGHT, "tall");
        node.put(PreferencesNames.VIEWPORT_MIN_ZOOM, "4");
        node.put(PreferencesNames.VIEWPORT_MAX_ZOOM, "2");
        ViewerPrefsSnapshot s = store.load();
        assertEquals(ViewerPrefsSnapshot.DEFAULT_RENDER_DEBOUNCE_MS, s.renderDebounceMs);
        assertEquals(ViewerPrefsSnapshot.DEFAULT_RENDER_HEIGHT, s.renderHeight);
        assertEquals(1f, s.viewportMinZoom, 0f);
        assertEquals(10f, s.viewportMaxZoom, 0f);
    }

    @Test
    public void lastDirectoryIsRemembered() {
        store.saveLastDirectory("/tmp/papers");
        assertEquals("/tmp/papers", store.load().lastDirectory);
    }
}
