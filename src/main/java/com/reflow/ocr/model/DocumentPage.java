package com.reflow.ocr.model;

import java.util.List;

public record DocumentPage(
    int index,
    int width,
    int height,
    List<DocumentBlock> blocks
) {

    public DocumentPage {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }
}
