package org.pinchpdf.core;

import java.io.Closeable;

/**
 * An open PDF document. Pages are opened on demand and must be closed by the caller;
 * closing the document closes any page that is still open.
 */
public interface PdfDocumentHandle extends Closeable {

    int getPageCount();

    /**
     * Opens the page at {@code index}.
     *
     * @throws IllegalArgumentException if the index is outside {@code [0, getPageCount())}
     * @throws IllegalStateException if the document is closed
     */
    PdfPageHandle openPage(int index);

    boolean isClosed();

    /** Idempotent; never throws for an already closed document. */
    @Override
    void close();
}
