package com.reflow.ocr.pipeline;

import java.awt.image.BufferedImage;

/**
 * Cleans a scanned page before layout analysis. Implementations must not keep state
 * between calls.
 */
public interface ImagePreprocessor {
    BufferedImage process(BufferedImage image);
}
