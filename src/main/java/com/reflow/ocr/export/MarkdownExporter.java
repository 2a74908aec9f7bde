package com.reflow.ocr.export;

import com.reflow.ocr.model.BlockType;
import com.reflow.ocr.model.Document;
import com.reflow.ocr.model.DocumentBlock;
import com.reflow.ocr.model.DocumentPage;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

@Component
public class MarkdownExporter implements DocumentExporter {

    static final String TITLE = "# Recognized document";

    @Override
    public ExportFormat format() {
        return ExportFormat.MARKDOWN;
    }

    @Override
    public ExportResult export(Document document, String filenameBase) {
        List<String> lines = new ArrayList<>();
        lines.add(TITLE);
        lines.add("");
        for (DocumentPage page : document.pages()) {
            lines.add("## Page " + (page.index() + 1));
            for (DocumentBlock block : page.blocks()) {
                String text = BlockText.of(block);
                if (text.isEmpty()) {
                    continue;
                }
                lines.add(block.type() == BlockType.HEADER ? "**" + text + "**" : text);
                lines.add("");
            }
        }
        byte[] content = String.join("\n", lines).getBytes(StandardCharsets.UTF_8);
        return new ExportResult(filenameBase + format().extension(), format().mediaType(), content);
    }
}
