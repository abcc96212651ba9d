package org.pinchpdf.core;

/** Quality profile requested from the rasterizer. */
public enum RenderMode {
    /** Screen rendering. */
    FOR_DISPLAY,
    /** Print rendering: no optional-content view state, print hints. */
    FOR_PRINT
}
