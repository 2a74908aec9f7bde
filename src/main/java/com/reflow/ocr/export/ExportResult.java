package com.reflow.ocr.export;

public record ExportResult(
    String filename,
    String mediaType,
    byte[] content
) {}
