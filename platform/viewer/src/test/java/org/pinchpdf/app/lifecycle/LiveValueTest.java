package org.pinchpdf.app.lifecycle;

import org.junit.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.junit.Assert.*;

public class LiveValueTest {

    @Test
    public void observerGetsCurrentValueThenUpdates() {
        LiveValue<Integer> live = new LiveValue<>(Runnable::run, 1);
        List<Integer> seen = new ArrayList<>();
        live.observe(seen::add);
        live.setValue(2);
        assertEquals(List.of(1, 2), seen);
        assertEquals(Integer.valueOf(2), live.getValue());
    }

    @Test
    public void postValueWaitsForUiExecutor() {
        Deque<Runnable> ui = new ArrayDeque<>();
        LiveValue<String> live = new LiveValue<>(ui::add, null);
        live.postValue("done");
        assertNull(live.getValue());

        ui.poll().run();
        assertEquals("done", live.getValue());
    }

    @Test
    public void removedObserverStopsReceiving() {
        LiveValue<Integer> live = new LiveValue<>(Runnable::run, 0);
        List<Integer> seen = new ArrayList<>();
        LiveValue.Subscription s = live.observe(seen::add);
        assertTrue(live.hasObservers());
        s.remove();
        live.setValue(5);
        assertEquals(List.of(0), seen);
        assertFalse(live.hasObservers());
    }
}
