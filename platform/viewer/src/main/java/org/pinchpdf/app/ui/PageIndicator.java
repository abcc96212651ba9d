package org.pinchpdf.app.ui;

import javax.annotation.Nullable;

/** Formats the "Page n of N" label. */
public final class PageIndicator {
    private PageIndicator() {}

    public static String format(@Nullable Integer pageIndex, @Nullable Integer totalPages) {
        int total = totalPages != null ? totalPages : 0;
        int page = pageIndex != null ? pageIndex + 1 : 1;
        if (total == 0) page = 0;
        return "Page " + page + " of " + total;
    }
}
