package org.pinchpdf.app.reader;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class ViewportStateTest {

    // A 200x300 page in a 400x600 view fills it exactly at zoom 1.
    private static final int VIEW_W = 400;
    private static final int VIEW_H = 600;
    private static final int PAGE_W = 200;
    private static final int PAGE_H = 300;

    private ViewportState state;

    @Before
    public void setUp() {
        state = new ViewportState(1f, 10f);
    }

    private boolean scale(float factor, float fx, float fy) {
        return state.applyScale(factor, fx, fy, VIEW_W, VIEW_H, PAGE_W, PAGE_H);
    }

    private boolean scroll(float dx, float dy) {
        return state.applyScroll(dx, dy, VIEW_W, VIEW_H, PAGE_W, PAGE_H);
    }

    @Test
    public void panIsPinnedAtFitZoom() {
        assertFalse(scroll(50f, 50f));
        assertEquals(0f, state.getPanX(), 0f);
        assertEquals(0f, state.getPanY(), 0f);
    }

    @Test
    public void scaleAroundCenterKeepsCenterFixed() {
        assertTrue(scale(2f, 200f, 300f));
        assertEquals(2f, state.getZoom(), 0f);
        assertEquals(-200f, state.getPanX(), 1e-4f);
        assertEquals(-300f, state.getPanY(), 1e-4f);
    }

    @Test
    public void zoomIsClampedToRange() {
        scale(100f, 0f, 0f);
        assertEquals(10f, state.getZoom(), 0f);
        state.reset();
        assertFalse(scale(0.1f, 0f, 0f));
        assertEquals(1f, state.getZoom(), 0f);
    }

    @Test
    public void scrollMovesContentAgainstDistanceAndClamps() {
        scale(2f, 200f, 300f);
        assertTrue(scroll(50f, 20f));
        assertEquals(-250f, state.getPanX(), 1e-4f);
        assertEquals(-320f, state.getPanY(), 1e-4f);

        scroll(1000f, 1000f);
        assertEquals(-400f, state.getPanX(), 1e-4f);
        assertEquals(-600f, state.getPanY(), 1e-4f);

        scroll(-5000f, -5000f);
        assertEquals(0f, state.getPanX(), 0f);
        assertEquals(0f, state.getPanY(), 0f);
    }

    @Test
    public void resetRestoresFitView() {
        scale(3f, 10f, 10f);
        state.reset();
        assertEquals(1f, state.getZoom(), 0f);
        assertEquals(0f, state.getPanX(), 0f);
        assertEquals(0f, state.getPanY(), 0f);
    }

    @Test
    public void shorterPageMayMoveWithinView() {
        // 200x100 page in a 400x600 view: content is 400x200, so y may range over [0, 400].
        assertTrue(state.applyScroll(0f, -150f, VIEW_W, VIEW_H, 200, 100));
        assertEquals(150f, state.getPanY(), 0f);
        state.applyScroll(0f, -1000f, VIEW_W, VIEW_H, 200, 100);
        assertEquals(400f, state.getPanY(), 0f);
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidRangeIsRejected() {
        new ViewportState(2f, 1f);
    }
}
