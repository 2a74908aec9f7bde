package com.reflow.ocr.model;

import java.util.List;

public record DocumentBlock(
    String id,
    BlockType type,
    BoundingBox bbox,
    List<TextSpan> spans
) {

    public DocumentBlock {
        type = type == null ? BlockType.PARAGRAPH : type;
        bbox = bbox == null ? BoundingBox.empty() : bbox;
        spans = spans == null ? List.of() : List.copyOf(spans);
    }
}
