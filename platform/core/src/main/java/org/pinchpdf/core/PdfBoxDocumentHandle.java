package org.pinchpdf.core;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.rendering.RenderDestination;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import javax.annotation.Nullable;

/**
 * PDFBox-backed document handle.
 * <p>
 * PDFBox renderers are not thread-safe, so every rasterization on one document runs under the
 * document lock. Page handles are cheap views onto a page index and several may be open at once.
 */
public final class PdfBoxDocumentHandle implements PdfDocumentHandle {
    private static final Logger LOG = LoggerFactory.getLogger(PdfBoxDocumentHandle.class);

    private final Object lock = new Object();
    private final PDDocument document;
    private final PDFRenderer renderer;
    private final Set<Page> openPages = new LinkedHashSet<>();
    private volatile boolean closed;

    private PdfBoxDocumentHandle(PDDocument document) {
        this.document = document;
        this.renderer = new PDFRenderer(document);
        this.renderer.setSubsamplingAllowed(false);
    }

    public static PdfBoxDocumentHandle open(File file) throws IOException {
        if (file == null) throw new IllegalArgumentException("file == null");
        PdfBoxDocumentHandle handle = new PdfBoxDocumentHandle(Loader.loadPDF(file));
        LOG.info("Opened {}: {} pages", file.getName(), handle.getPageCount());
        return handle;
    }

    public static PdfBoxDocumentHandle open(byte[] bytes) throws IOException {
        if (bytes == null) throw new IllegalArgumentException("bytes == null");
        PdfBoxDocumentHandle handle = new PdfBoxDocumentHandle(Loader.loadPDF(bytes));
        LOG.info("Opened in-memory document: {} pages", handle.getPageCount());
        return handle;
    }

    @Override
    public int getPageCount() {
        ensureOpen();
        return document.getNumberOfPages();
    }

    @Override
    public PdfPageHandle openPage(int index) {
        synchronized (lock) {
            ensureOpen();
            int count = document.getNumberOfPages();
            if (index < 0 || index >= count) {
                throw new IllegalArgumentException("Page index " + index + " out of range [0, " + count + ")");
            }
            PDPage pdPage = document.getPage(index);
            PDRectangle crop = pdPage.getCropBox();
            int rotation = ((pdPage.getRotation() % 360) + 360) % 360;
            boolean swap = rotation == 90 || rotation == 270;
            int width = Math.round(swap ? crop.getHeight() : crop.getWidth());
            int height = Math.round(swap ? crop.getWidth() : crop.getHeight());
            Page page = new Page(index, width, height);
            openPages.add(page);
            return page;
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        List<Page> pages;
        synchronized (lock) {
            if (closed) return;
            closed = true;
            pages = new ArrayList<>(openPages);
            openPages.clear();
        }
        for (Page p : pages) p.markClosed();
        try {
            document.close();
        } catch (IOException e) {
            LOG.warn("Error closing PDDocument", e);
        }
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("Document is closed");
    }

    private void renderLocked(Page page,
                              BufferedImage target,
                              @Nullable Rectangle destClip,
                              @Nullable AffineTransform transform,
                              RenderMode mode) throws IOException {
        synchronized (lock) {
            ensureOpen();
            if (page.closed) throw new IllegalStateException("Page " + page.index + " is closed");

            Graphics2D g = target.createGraphics();
            try {
                g.setBackground(Color.WHITE);
                g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
                g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
                g.setRenderingHint(RenderingHints.KEY_RENDERING,
                        mode == RenderMode.FOR_PRINT
                                ? RenderingHints.VALUE_RENDER_QUALITY
                                : RenderingHints.VALUE_RENDER_SPEED);
                if (destClip != null) g.clip(destClip);
                g.transform(transform != null ? transform : stretchTransform(page, target));
                renderer.renderPageToGraphics(page.index, g, 1f, 1f,
                        mode == RenderMode.FOR_PRINT ? RenderDestination.PRINT : RenderDestination.VIEW);
            } finally {
                g.dispose();
            }
        }
    }

    private static AffineTransform stretchTransform(Page page, BufferedImage target) {
        double sx = (double) target.getWidth() / Math.max(1, page.width);
        double sy = (double) target.getHeight() / Math.max(1, page.height);
        return AffineTransform.getScaleInstance(sx, sy);
    }

    private final class Page implements PdfPageHandle {
        private final int index;
        private final int width;
        private final int height;
        private volatile boolean closed;

        Page(int index, int width, int height) {
            this.index = index;
            this.width = width;
            this.height = height;
        }

        @Override public int getIndex() { return index; }
        @Override public int getWidth() { return width; }
        @Override public int getHeight() { return height; }
        @Override public boolean isClosed() { return closed || PdfBoxDocumentHandle.this.closed; }

        @Override
        public void render(BufferedImage target,
                           @Nullable Rectangle destClip,
                           @Nullable AffineTransform transform,
                           RenderMode mode) throws IOException {
            if (target == null) throw new IllegalArgumentException("target == null");
            renderLocked(this, target, destClip, transform, mode != null ? mode : RenderMode.FOR_DISPLAY);
        }

        @Override
        public void close() {
            synchronized (lock) {
                openPages.remove(this);
            }
            markClosed();
        }

        void markClosed() {
            closed = true;
        }
    }
}
