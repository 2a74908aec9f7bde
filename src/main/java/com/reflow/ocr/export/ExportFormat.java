package com.reflow.ocr.export;

import com.reflow.ocr.exception.UnsupportedExportFormatException;

import java.util.Locale;

public enum ExportFormat {
    MARKDOWN("markdown", ".md", "text/markdown; charset=utf-8"),
    TEXT("text", ".txt", "text/plain; charset=utf-8"),
    JSON("json", ".json", "application/json");

    private final String wireName;
    private final String extension;
    private final String mediaType;

    ExportFormat(String wireName, String extension, String mediaType) {
        this.wireName = wireName;
        this.extension = extension;
        this.mediaType = mediaType;
    }

    public String wireName() {
        return wireName;
    }

    public String extension() {
        return extension;
    }

    public String mediaType() {
        return mediaType;
    }

    public static ExportFormat fromWireName(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (ExportFormat format : values()) {
                if (format.wireName.equals(normalized)) {
                    return format;
                }
            }
        }
        throw new UnsupportedExportFormatException(value);
    }
}
