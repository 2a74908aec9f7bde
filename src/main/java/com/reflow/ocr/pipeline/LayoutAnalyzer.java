package com.reflow.ocr.pipeline;

import java.awt.image.BufferedImage;
import java.util.List;

public interface LayoutAnalyzer {

    /**
     * @return candidate text regions in reading order, never empty
     */
    List<LayoutBlock> analyze(BufferedImage image);
}
