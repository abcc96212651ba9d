package org.pinchpdf.app.document;

import org.pinchpdf.app.preferences.ViewerPrefsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Component;
import java.io.File;

import javax.annotation.Nullable;
import javax.swing.JFileChooser;
import javax.swing.filechooser.FileNameExtensionFilter;

/**
 * Shows the PDF open dialog and remembers the directory of the last pick.
 */
public final class PdfFileChooser {
    private static final Logger LOG = LoggerFactory.getLogger(PdfFileChooser.class);

    private final ViewerPrefsStore prefsStore;
    @Nullable private String lastDirectory;

    public PdfFileChooser(ViewerPrefsStore prefsStore, @Nullable String lastDirectory) {
        this.prefsStore = prefsStore;
        this.lastDirectory = lastDirectory;
    }

    /** @return the picked file, or null when the dialog was dismissed */
    @Nullable
    public File choose(Component parent) {
        JFileChooser chooser = new JFileChooser(lastDirectory);
        chooser.setFileFilter(new FileNameExtensionFilter("PDF documents", "pdf"));
        chooser.setAcceptAllFileFilterUsed(false);
        if (chooser.showOpenDialog(parent) != JFileChooser.APPROVE_OPTION) return null;

        File picked = chooser.getSelectedFile();
        if (picked == null) return null;
        File dir = picked.getParentFile();
        if (dir != null) {
            lastDirectory = dir.getAbsolutePath();
            try {
                prefsStore.saveLastDirectory(lastDirectory);
            } catch (RuntimeException e) {
                LOG.warn("Failed remembering directory {}", lastDirectory, e);
            }
        }
        return picked;
    }
}
