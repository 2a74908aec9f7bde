package com.reflow.ocr.pipeline;

import com.reflow.ocr.model.DocumentBlock;

import java.awt.image.BufferedImage;

public interface TextRecognizer {
    DocumentBlock recognize(BufferedImage image, LayoutBlock block);
}
