package org.pinchpdf.app.util;

import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

/** Small helpers for the render target images. */
public final class Bitmaps {
    private Bitmaps() {}

    public static BufferedImage create(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Invalid bitmap size " + width + "x" + height);
        }
        return new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
    }

    /** Fills the whole image with {@code color}, replacing alpha as well. */
    public static void eraseColor(BufferedImage image, Color color) {
        Graphics2D g = image.createGraphics();
        try {
            g.setComposite(AlphaComposite.Src);
            g.setColor(color);
            g.fillRect(0, 0, image.getWidth(), image.getHeight());
        } finally {
            g.dispose();
        }
    }
}
