package org.pinchpdf.core;

import java.io.File;
import java.io.IOException;

/** Opens a document from a file. Implemented by {@link PdfBoxDocumentHandle#open(File)}. */
@FunctionalInterface
public interface PdfDocumentOpener {
    PdfDocumentHandle open(File file) throws IOException;
}
