package org.pinchpdf;

import org.pinchpdf.app.di.DaggerViewerComponent;
import org.pinchpdf.app.di.ViewerComponent;
import org.pinchpdf.app.preferences.JavaPrefsViewerPrefsStore;
import org.pinchpdf.app.ui.MainWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

import javax.swing.SwingUtilities;
import javax.swing.UIManager;

/**
 * Entry point. Builds the object graph and shows the main window; an optional first argument
 * names a PDF to open on start.
 */
public final class PinchPdfApp {
    private static final Logger LOG = LoggerFactory.getLogger(PinchPdfApp.class);

    private PinchPdfApp() {}

    public static void main(String[] args) {
        Thread.setDefaultUncaughtExceptionHandler((t, e) -> LOG.error("Uncaught exception on {}", t.getName(), e));

        ViewerComponent component = DaggerViewerComponent.factory()
                .create(JavaPrefsViewerPrefsStore.forCurrentUser(), SwingUtilities::invokeLater);

        SwingUtilities.invokeLater(() -> {
            try {
                UIManager.setLookAndFeel(UIManager.getSystemLookAndFeelClassName());
            } catch (Exception e) {
                LOG.warn("System look and feel unavailable", e);
            }
            MainWindow window = new MainWindow(component);
            window.setVisible(true);
            if (args.length > 0) {
                window.openFile(new File(args[0]));
            }
            LOG.info("PinchPDF started");
        });
    }
}
