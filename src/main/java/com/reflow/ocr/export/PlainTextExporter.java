package com.reflow.ocr.export;

import com.reflow.ocr.model.Document;
import com.reflow.ocr.model.DocumentBlock;
import com.reflow.ocr.model.DocumentPage;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Blocks separated by blank lines, pages by a form feed.
 */
@Component
public class PlainTextExporter implements DocumentExporter {

    @Override
    public ExportFormat format() {
        return ExportFormat.TEXT;
    }

    @Override
    public ExportResult export(Document document, String filenameBase) {
        StringBuilder out = new StringBuilder();
        for (DocumentPage page : document.pages()) {
            if (out.length() > 0) {
                out.append('\f');
            }
            for (DocumentBlock block : page.blocks()) {
                String text = BlockText.of(block);
                if (!text.isEmpty()) {
                    out.append(text).append("\n\n");
                }
            }
        }
        return new ExportResult(filenameBase + format().extension(), format().mediaType(),
            out.toString().getBytes(StandardCharsets.UTF_8));
    }
}
