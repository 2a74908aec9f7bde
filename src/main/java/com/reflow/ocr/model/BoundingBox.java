package com.reflow.ocr.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Pixel rectangle, written as {@code [x, y, w, h]}.
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"x", "y", "width", "height"})
public record BoundingBox(int x, int y, int width, int height) {

    public static BoundingBox empty() {
        return new BoundingBox(0, 0, 0, 0);
    }
}
