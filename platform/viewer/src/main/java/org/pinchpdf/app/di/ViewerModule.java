package org.pinchpdf.app.di;

import org.pinchpdf.app.preferences.ViewerPrefsSnapshot;
import org.pinchpdf.app.preferences.ViewerPrefsStore;
import org.pinchpdf.app.reader.RenderTimer;
import org.pinchpdf.app.reader.ScheduledRenderTimer;
import org.pinchpdf.core.PdfBoxDocumentHandle;
import org.pinchpdf.core.PdfDocumentOpener;

import java.util.concurrent.Executor;
import java.util.concurrent.Executors;

import javax.inject.Named;
import javax.inject.Singleton;

import dagger.Module;
import dagger.Provides;

@Module
public final class ViewerModule {
    public static final String UI = "ui";
    public static final String BACKGROUND = "background";

    private ViewerModule() {}

    @Provides
    @Singleton
    static ViewerPrefsSnapshot providePrefsSnapshot(ViewerPrefsStore store) {
        return store.load();
    }

    @Provides
    static PdfDocumentOpener provideDocumentOpener() {
        return PdfBoxDocumentHandle::open;
    }

    @Provides
    @Singleton
    @Named(BACKGROUND)
    static Executor provideBackgroundExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "pdf-background");
            t.setDaemon(true);
            return t;
        });
    }

    @Provides
    @Singleton
    static RenderTimer provideRenderTimer() {
        return new ScheduledRenderTimer();
    }
}
