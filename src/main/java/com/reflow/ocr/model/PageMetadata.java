package com.reflow.ocr.model;

public record PageMetadata(
    Integer width,
    Integer height,
    Integer dpi,
    String mimetype
) {

    public static PageMetadata unknown(String mimetype) {
        return new PageMetadata(null, null, null, mimetype);
    }
}
