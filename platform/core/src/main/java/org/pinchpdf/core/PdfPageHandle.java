package org.pinchpdf.core;

import java.awt.Rectangle;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.io.Closeable;
import java.io.IOException;

import javax.annotation.Nullable;

/**
 * One open page of a {@link PdfDocumentHandle}.
 * <p>
 * Page space is measured in points with the origin at the top-left corner and y growing
 * downwards, after the page rotation has been applied.
 */
public interface PdfPageHandle extends Closeable {

    int getIndex();

    /** Page width in points. */
    int getWidth();

    /** Page height in points. */
    int getHeight();

    /**
     * Rasterizes the page into {@code target}. The target is not cleared first.
     *
     * @param destClip  optional rectangle of the target to draw into; null draws anywhere
     * @param transform page space to target pixels; null stretches the page over the whole target
     * @throws IOException when the page content cannot be rasterized
     * @throws IllegalStateException if this page or its document is closed
     */
    void render(BufferedImage target,
                @Nullable Rectangle destClip,
                @Nullable AffineTransform transform,
                RenderMode mode) throws IOException;

    boolean isClosed();

    /** Idempotent. */
    @Override
    void close();
}
