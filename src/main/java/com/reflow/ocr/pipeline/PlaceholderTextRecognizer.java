package com.reflow.ocr.pipeline;

import com.reflow.ocr.model.DocumentBlock;
import com.reflow.ocr.model.TextSpan;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Emits a fixed notice instead of recognized text when no OCR engine is configured.
 */
@Component
public class PlaceholderTextRecognizer implements TextRecognizer {

    static final String PLACEHOLDER_TEXT =
        "OCR engine unavailable. Configure a text recognizer to enable recognition.";

    @Override
    public DocumentBlock recognize(BufferedImage image, LayoutBlock block) {
        TextSpan span = new TextSpan(PLACEHOLDER_TEXT, 0.0, block.bbox());
        return new DocumentBlock(block.id(), block.type(), block.bbox(), List.of(span));
    }
}
