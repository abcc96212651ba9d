package org.pinchpdf.app.viewmodel;

import org.pinchpdf.app.di.ViewerModule;
import org.pinchpdf.app.gesture.ZoomListener;
import org.pinchpdf.app.lifecycle.LiveValue;
import org.pinchpdf.app.preferences.ViewerPrefsSnapshot;
import org.pinchpdf.app.util.Bitmaps;
import org.pinchpdf.core.PdfDocumentHandle;
import org.pinchpdf.core.PdfDocumentOpener;
import org.pinchpdf.core.PdfPageHandle;
import org.pinchpdf.core.RenderMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;

import javax.annotation.Nullable;
import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;

/**
 * Document and page state for the viewer window. Document work runs on the background executor;
 * results are published through {@link LiveValue#postValue}.
 */
@Singleton
public class PdfViewModel implements ZoomListener {
    private static final Logger LOG = LoggerFactory.getLogger(PdfViewModel.class);

    public static final float MIN_ZOOM = 0.5f;
    public static final float MAX_ZOOM = 5f;

    private final PdfDocumentOpener opener;
    private final Executor background;
    private final int renderWidth;
    private final int renderHeight;

    @Nullable private volatile PdfDocumentHandle pdfDocument;

    private final LiveValue<Integer> currentPage;
    private final LiveValue<Integer> totalPages;
    private final LiveValue<Float> zoomLevel;
    private final LiveValue<Float> scrollX;
    private final LiveValue<Float> scrollY;
    private final LiveValue<BufferedImage> currentPageBitmap;
    private final LiveValue<Boolean> isLoading;
    private final LiveValue<String> error;

    @Inject
    public PdfViewModel(PdfDocumentOpener opener,
                        @Named(ViewerModule.BACKGROUND) Executor background,
                        @Named(ViewerModule.UI) Executor uiExecutor,
                        ViewerPrefsSnapshot prefs) {
        this.opener = opener;
        this.background = background;
        this.renderWidth = prefs.renderWidth;
        this.renderHeight = prefs.renderHeight;

        this.currentPage = new LiveValue<>(uiExecutor, 0);
        this.totalPages = new LiveValue<>(uiExecutor, 0);
        this.zoomLevel = new LiveValue<>(uiExecutor, 1f);
        this.scrollX = new LiveValue<>(uiExecutor, 0f);
        this.scrollY = new LiveValue<>(uiExecutor, 0f);
        this.currentPageBitmap = new LiveValue<>(uiExecutor, null);
        this.isLoading = new LiveValue<>(uiExecutor, false);
        this.error = new LiveValue<>(uiExecutor, null);
    }

    public LiveValue<Integer> getCurrentPage() { return currentPage; }
    public LiveValue<Integer> getTotalPages() { return totalPages; }
    public LiveValue<Float> getZoomLevel() { return zoomLevel; }
    public LiveValue<Float> getScrollX() { return scrollX; }
    public LiveValue<Float> getScrollY() { return scrollY; }
    public LiveValue<BufferedImage> getCurrentPageBitmap() { return currentPageBitmap; }
    public LiveValue<Boolean> getIsLoading() { return isLoading; }
    public LiveValue<String> getError() { return error; }

    public int getRenderWidth() { return renderWidth; }
    public int getRenderHeight() { return renderHeight; }

    public void openPdf(File file) {
        background.execute(() -> {
            try {
                isLoading.postValue(true);
                closeDocument();
                PdfDocumentHandle doc = opener.open(file);
                pdfDocument = doc;
                totalPages.postValue(doc.getPageCount());
                currentPage.postValue(0);
                zoomLevel.postValue(1f);
                scrollX.postValue(0f);
                scrollY.postValue(0f);
                error.postValue(null);
                renderPage(0);
            } catch (IOException | RuntimeException e) {
                LOG.error("Failed to open {}", file, e);
                error.postValue("Failed to open PDF: " + e.getMessage());
            } finally {
                isLoading.postValue(false);
            }
        });
    }

    public void goToPage(int pageIndex) {
        int total = valueOr(totalPages, 0);
        if (pageIndex >= 0 && pageIndex < total) {
            currentPage.setValue(pageIndex);
            scrollX.setValue(0f);
            scrollY.setValue(0f);
            renderPage(pageIndex);
        }
    }

    public void nextPage() {
        int page = valueOr(currentPage, 0);
        int total = valueOr(totalPages, 0);
        if (page < total - 1) {
            goToPage(page + 1);
        }
    }

    public void previousPage() {
        int page = valueOr(currentPage, 0);
        if (page > 0) {
            goToPage(page - 1);
        }
    }

    public void setZoomLevel(float zoom) {
        zoomLevel.setValue(Math.min(Math.max(zoom, MIN_ZOOM), MAX_ZOOM));
    }

    public void updateScroll(float x, float y) {
        float maxX = getMaxScrollX();
        float maxY = getMaxScrollY();
        scrollX.setValue(Math.min(Math.max(x, 0f), maxX));
        scrollY.setValue(Math.min(Math.max(y, 0f), maxY));
    }

    public void resetZoom() {
        zoomLevel.setValue(1f);
        scrollX.setValue(0f);
        scrollY.setValue(0f);
    }

    @Override
    public void onZoomChange(float zoom) {
        setZoomLevel(zoom);
    }

    public void clearError() {
        error.setValue(null);
    }

    public float getMaxScrollX() {
        BufferedImage bitmap = currentPageBitmap.getValue();
        if (bitmap == null) return 0f;
        return Math.max(bitmap.getWidth() * valueOr(zoomLevel, 1f) - renderWidth, 0f);
    }

    public float getMaxScrollY() {
        BufferedImage bitmap = currentPageBitmap.getValue();
        if (bitmap == null) return 0f;
        return Math.max(bitmap.getHeight() * valueOr(zoomLevel, 1f) - renderHeight, 0f);
    }

    public boolean hasDocument() {
        return pdfDocument != null;
    }

    /**
     * Opens the current page for the vector zoom view. The caller owns the returned page and
     * closes it.
     *
     * @return null when no document is open
     */
    @Nullable
    public PdfPageHandle openViewportPage() {
        PdfDocumentHandle doc = pdfDocument;
        if (doc == null || doc.isClosed()) return null;
        return doc.openPage(valueOr(currentPage, 0));
    }

    private void renderPage(int pageIndex) {
        background.execute(() -> {
            PdfDocumentHandle doc = pdfDocument;
            if (doc == null) return;
            try (PdfPageHandle page = doc.openPage(pageIndex)) {
                BufferedImage bitmap = Bitmaps.create(renderWidth, renderHeight);
                Bitmaps.eraseColor(bitmap, Color.WHITE);
                page.render(bitmap, null, null, RenderMode.FOR_DISPLAY);
                currentPageBitmap.postValue(bitmap);
            } catch (IOException | RuntimeException e) {
                LOG.error("Failed to render page {}", pageIndex, e);
                error.postValue("Failed to render page: " + e.getMessage());
            }
        });
    }

    public void closePdf() {
        closeDocument();
    }

    /** Releases the document and stops background work; the view model is unusable afterwards. */
    public void onCleared() {
        closePdf();
        if (background instanceof ExecutorService) {
            ((ExecutorService) background).shutdown();
        }
    }

    private void closeDocument() {
        PdfDocumentHandle doc = pdfDocument;
        pdfDocument = null;
        if (doc == null) return;
        try {
            doc.close();
        } catch (RuntimeException e) {
            LOG.warn("Error closing document", e);
        }
    }

    private static <T> T valueOr(LiveValue<T> live, T fallback) {
        T v = live.getValue();
        return v != null ? v : fallback;
    }
}
