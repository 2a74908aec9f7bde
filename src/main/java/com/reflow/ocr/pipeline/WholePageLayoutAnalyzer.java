package com.reflow.ocr.pipeline;

import com.reflow.ocr.model.BlockType;
import com.reflow.ocr.model.BoundingBox;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.UUID;

/**
 * Treats the whole page as one paragraph. Used until a real block detector is plugged in.
 */
@Component
public class WholePageLayoutAnalyzer implements LayoutAnalyzer {

    @Override
    public List<LayoutBlock> analyze(BufferedImage image) {
        BoundingBox page = new BoundingBox(0, 0, image.getWidth(), image.getHeight());
        return List.of(new LayoutBlock(UUID.randomUUID().toString(), page, BlockType.PARAGRAPH));
    }
}
