package org.pinchpdf.app.gesture;

import org.pinchpdf.app.viewmodel.PdfViewModel;

import javax.inject.Inject;

/**
 * Applies pinch steps to the view model's zoom level.
 */
public class PinchZoomGestureListener implements ScaleGestureDetector.OnScaleGestureListener {

    private final PdfViewModel pdfViewModel;

    private float lastScaleX = 0f;
    private float lastScaleY = 0f;

    @Inject
    public PinchZoomGestureListener(PdfViewModel pdfViewModel) {
        this.pdfViewModel = pdfViewModel;
    }

    @Override
    public boolean onScale(ScaleGestureDetector detector) {
        float scaleFactor = detector.getScaleFactor();
        Float value = pdfViewModel.getZoomLevel().getValue();
        float currentZoom = value != null ? value : 1f;
        float newZoom = Math.min(Math.max(currentZoom * scaleFactor, PdfViewModel.MIN_ZOOM), PdfViewModel.MAX_ZOOM);

        if (newZoom != currentZoom) {
            pdfViewModel.onZoomChange(newZoom);
        }
        return true;
    }

    @Override
    public boolean onScaleBegin(ScaleGestureDetector detector) {
        lastScaleX = detector.getFocusX();
        lastScaleY = detector.getFocusY();
        return true;
    }

    @Override
    public void onScaleEnd(ScaleGestureDetector detector) {
    }

    public float getLastScaleX() {
        return lastScaleX;
    }

    public float getLastScaleY() {
        return lastScaleY;
    }
}
