package com.reflow.ocr.export;

import com.reflow.ocr.model.Document;

public interface DocumentExporter {

    ExportFormat format();

    /**
     * @param filenameBase file name without extension
     */
    ExportResult export(Document document, String filenameBase);
}
