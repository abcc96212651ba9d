package org.pinchpdf.app.reader;

import org.junit.Test;

import static org.junit.Assert.*;

public class ZoomControllerTest {

    @Test
    public void clampScaleRespectsBounds() {
        assertEquals(5f, ZoomController.clampScale(2f, 3f, 1f, 5f), 0f);
        assertEquals(1f, ZoomController.clampScale(1f, 0.5f, 1f, 10f), 0f);
        assertEquals(3f, ZoomController.clampScale(1.5f, 2f, 1f, 10f), 1e-6f);
    }

    @Test
    public void focusPointStaysFixedWhenZooming() {
        float[] pan = ZoomController.computePanForScale(1f, 2f, 0f, 0f, 100f, 50f);
        assertEquals(-100f, pan[0], 1e-6f);
        assertEquals(-50f, pan[1], 1e-6f);

        // Content point under the focus before and after: (focus - pan) / scale.
        float before = (100f - 0f) / 1f;
        float after = (100f - pan[0]) / 2f;
        assertEquals(before, after, 1e-6f);
    }

    @Test
    public void zeroPreviousScaleLeavesPanUnchanged() {
        float[] pan = ZoomController.computePanForScale(0f, 2f, 7f, 9f, 100f, 50f);
        assertEquals(7f, pan[0], 0f);
        assertEquals(9f, pan[1], 0f);
    }
}
