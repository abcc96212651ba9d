package org.pinchpdf.app.reader;

import org.junit.Test;

import java.awt.image.BufferedImage;

import static org.junit.Assert.*;

public class RenderBitmapPoolTest {

    @Test
    public void alternatesBetweenTwoBuffers() {
        RenderBitmapPool pool = new RenderBitmapPool();
        BufferedImage a = pool.next(null, 10, 20);
        BufferedImage b = pool.next(a, 10, 20);
        assertNotSame(a, b);
        assertSame(a, pool.next(b, 10, 20));
        assertSame(b, pool.next(a, 10, 20));
        assertEquals(10, a.getWidth());
        assertEquals(20, a.getHeight());
    }

    @Test
    public void sizeChangeReallocates() {
        RenderBitmapPool pool = new RenderBitmapPool();
        BufferedImage a = pool.next(null, 10, 10);
        BufferedImage b = pool.next(a, 10, 10);
        BufferedImage c = pool.next(b, 30, 40);
        assertNotSame(a, c);
        assertEquals(30, c.getWidth());
        assertEquals(40, c.getHeight());
    }

    @Test
    public void neverReturnsBufferInUse() {
        RenderBitmapPool pool = new RenderBitmapPool();
        BufferedImage shown = pool.next(null, 10, 10);
        assertNotSame(shown, pool.next(shown, 10, 10));
        assertNotSame(shown, pool.next(shown, 10, 10));
    }
}
