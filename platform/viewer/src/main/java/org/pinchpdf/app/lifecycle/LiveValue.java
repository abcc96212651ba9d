package org.pinchpdf.app.lifecycle;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

import javax.annotation.Nullable;

/**
 * Observable value holder. {@link #setValue} notifies on the calling thread and is meant for the
 * UI thread; {@link #postValue} hops to the UI executor first and is safe from any thread.
 */
public final class LiveValue<T> {

    public interface Observer<T> {
        void onChanged(@Nullable T value);
    }

    /** Handle returned by {@link #observe}; removing it stops notifications. */
    public interface Subscription {
        void remove();
    }

    private final Executor uiExecutor;
    private final CopyOnWriteArrayList<Observer<T>> observers = new CopyOnWriteArrayList<>();
    @Nullable private volatile T value;

    public LiveValue(Executor uiExecutor, @Nullable T initialValue) {
        if (uiExecutor == null) throw new IllegalArgumentException("uiExecutor == null");
        this.uiExecutor = uiExecutor;
        this.value = initialValue;
    }

    @Nullable
    public T getValue() {
        return value;
    }

    public void setValue(@Nullable T newValue) {
        value = newValue;
        for (Observer<T> o : observers) {
            o.onChanged(newValue);
        }
    }

    public void postValue(@Nullable T newValue) {
        uiExecutor.execute(() -> setValue(newValue));
    }

    /** Registers {@code observer} and immediately delivers the current value to it. */
    public Subscription observe(Observer<T> observer) {
        if (observer == null) throw new IllegalArgumentException("observer == null");
        observers.add(observer);
        observer.onChanged(value);
        return () -> observers.remove(observer);
    }

    public boolean hasObservers() {
        return !observers.isEmpty();
    }
}
