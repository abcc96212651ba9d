package org.pinchpdf.app.gesture;

public interface ZoomListener {
    void onZoomChange(float zoomLevel);
}
