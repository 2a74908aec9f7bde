package com.reflow.ocr.export;

import com.reflow.ocr.model.DocumentBlock;
import com.reflow.ocr.model.TextSpan;

import java.util.stream.Collectors;

final class BlockText {

    private BlockText() {
    }

    static String of(DocumentBlock block) {
        return block.spans().stream()
            .map(TextSpan::text)
            .filter(text -> text != null && !text.isEmpty())
            .collect(Collectors.joining("\n"))
            .strip();
    }
}
