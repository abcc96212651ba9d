package org.pinchpdf.app.ui;

import org.pinchpdf.app.lifecycle.LiveValue;
import org.pinchpdf.app.reader.RenderTimer;
import org.pinchpdf.app.reader.VectorPdfView;
import org.pinchpdf.app.viewmodel.PdfViewModel;

import java.util.ArrayList;
import java.util.List;

/**
 * What the main window holds on to until it closes: observer subscriptions, the vector view's
 * page, the view model and the render thread.
 */
final class WindowResources {
    private final PdfViewModel pdfViewModel;
    private final VectorPdfView vectorPdfView;
    private final RenderTimer renderTimer;
    private final List<LiveValue.Subscription> subscriptions = new ArrayList<>();
    private boolean released;

    WindowResources(PdfViewModel pdfViewModel, VectorPdfView vectorPdfView, RenderTimer renderTimer) {
        this.pdfViewModel = pdfViewModel;
        this.vectorPdfView = vectorPdfView;
        this.renderTimer = renderTimer;
    }

    void track(LiveValue.Subscription subscription) {
        subscriptions.add(subscription);
    }

    /** Idempotent. */
    void release() {
        if (released) return;
        released = true;
        for (LiveValue.Subscription s : subscriptions) s.remove();
        subscriptions.clear();
        vectorPdfView.release();
        pdfViewModel.onCleared();
        renderTimer.shutdown();
    }
}
