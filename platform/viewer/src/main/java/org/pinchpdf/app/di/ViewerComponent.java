package org.pinchpdf.app.di;

import org.pinchpdf.app.gesture.PinchZoomGestureListener;
import org.pinchpdf.app.preferences.ViewerPrefsSnapshot;
import org.pinchpdf.app.preferences.ViewerPrefsStore;
import org.pinchpdf.app.reader.RenderTimer;
import org.pinchpdf.app.viewmodel.PdfViewModel;

import java.util.concurrent.Executor;

import javax.inject.Named;
import javax.inject.Singleton;

import dagger.BindsInstance;
import dagger.Component;

/**
 * Application-wide object graph. The prefs store and the UI executor come from the caller so
 * tests can run the graph without a display.
 */
@Singleton
@Component(modules = ViewerModule.class)
public interface ViewerComponent {

    PdfViewModel viewModel();

    PinchZoomGestureListener pinchZoomListener();

    ViewerPrefsSnapshot prefs();

    ViewerPrefsStore prefsStore();

    RenderTimer renderTimer();

    @Component.Factory
    interface Factory {
        ViewerComponent create(@BindsInstance ViewerPrefsStore prefsStore,
                               @BindsInstance @Named(ViewerModule.UI) Executor uiExecutor);
    }
}
