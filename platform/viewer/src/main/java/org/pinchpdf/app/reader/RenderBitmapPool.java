package org.pinchpdf.app.reader;

import java.awt.image.BufferedImage;

import javax.annotation.Nullable;

/**
 * Alternates between two reusable bitmaps sized to the view so a frame being painted is never
 * the one being rendered into.
 */
public final class RenderBitmapPool {
    private BufferedImage bm1;
    private BufferedImage bm2;

    /**
     * Returns a buffer of the given size that is not {@code inUse}, typically the frame on
     * screen.
     */
    public BufferedImage next(@Nullable BufferedImage inUse, int width, int height) {
        if (inUse == null || inUse != bm1) {
            bm1 = ensureSize(bm1, width, height);
            return bm1;
        } else {
            bm2 = ensureSize(bm2, width, height);
            return bm2;
        }
    }

    public void clear() {
        bm1 = null;
        bm2 = null;
    }

    private BufferedImage ensureSize(BufferedImage b, int width, int height) {
        if (b == null || b.getWidth() != width || b.getHeight() != height) {
            return new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        }
        return b;
    }
}
