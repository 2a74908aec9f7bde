package com.reflow.ocr.repository;

import java.util.Locale;
import java.util.UUID;

/**
 * Naming rules for stored page files: {@code {pageId}{extension}}.
 */
public final class PageFiles {

    private PageFiles() {
    }

    public static String filenameFor(UUID pageId, String originalName, String mimetype) {
        return pageId + resolveExtension(originalName, mimetype);
    }

    /**
     * Takes the suffix of the original name when it has one, otherwise infers it from
     * the MIME type.
     */
    public static String resolveExtension(String originalName, String mimetype) {
        if (originalName != null) {
            String name = originalName.substring(Math.max(originalName.lastIndexOf('/'), originalName.lastIndexOf('\\')) + 1);
            int dot = name.lastIndexOf('.');
            if (dot >= 0 && dot < name.length() - 1) {
                return "." + name.substring(dot + 1).toLowerCase(Locale.ROOT);
            }
        }
        if ("image/jpeg".equals(mimetype)) {
            return ".jpg";
        }
        if ("image/png".equals(mimetype)) {
            return ".png";
        }
        return ".bin";
    }
}
