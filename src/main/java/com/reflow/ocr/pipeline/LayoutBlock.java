package com.reflow.ocr.pipeline;

import com.reflow.ocr.model.BlockType;
import com.reflow.ocr.model.BoundingBox;

public record LayoutBlock(
    String id,
    BoundingBox bbox,
    BlockType type
) {}
