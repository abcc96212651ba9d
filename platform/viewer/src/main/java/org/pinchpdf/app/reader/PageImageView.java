package org.pinchpdf.app.reader;

import java.awt.Color;
import java.awt.Dimension;
import java.awt.Graphics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

import javax.annotation.Nullable;
import javax.swing.JComponent;

/**
 * Shows a full-page bitmap fitted to the view and scaled about the view center by the zoom
 * level, shifted by the scroll offset (in bitmap pixels at the current zoom).
 */
public class PageImageView extends JComponent {

    @Nullable private BufferedImage image;
    private float zoom = 1f;
    private float scrollX;
    private float scrollY;

    public PageImageView() {
        setOpaque(true);
        setBackground(Color.LIGHT_GRAY);
        setPreferredSize(new Dimension(600, 800));
    }

    public void setImageBitmap(@Nullable BufferedImage image) {
        this.image = image;
        repaint();
    }

    public void setZoom(float zoom) {
        this.zoom = zoom;
        repaint();
    }

    public void setScroll(float scrollX, float scrollY) {
        this.scrollX = scrollX;
        this.scrollY = scrollY;
        repaint();
    }

    /** Factor from bitmap pixels to view pixels at zoom 1. */
    public float fitScale() {
        BufferedImage img = image;
        if (img == null || getWidth() == 0 || getHeight() == 0) return 1f;
        return Math.min((float) getWidth() / img.getWidth(), (float) getHeight() / img.getHeight());
    }

    @Override
    protected void paintComponent(Graphics graphics) {
        graphics.setColor(getBackground());
        graphics.fillRect(0, 0, getWidth(), getHeight());
        BufferedImage img = image;
        if (img == null) return;

        float fit = fitScale();
        Graphics2D g = (Graphics2D) graphics.create();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.translate(getWidth() / 2.0 - scrollX * fit, getHeight() / 2.0 - scrollY * fit);
            g.scale(fit * zoom, fit * zoom);
            g.translate(-img.getWidth() / 2.0, -img.getHeight() / 2.0);
            g.drawImage(img, 0, 0, null);
        } finally {
            g.dispose();
        }
    }
}
