package com.reflow.ocr.model;

public record TextSpan(
    String text,
    double confidence,
    BoundingBox bbox
) {}
