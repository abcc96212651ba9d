package org.pinchpdf.app.preferences;

/** Persistence boundary for viewer preferences. */
public interface ViewerPrefsStore {
    ViewerPrefsSnapshot load();

    void saveLastDirectory(String directory);
}
