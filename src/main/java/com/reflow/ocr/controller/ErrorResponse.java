package com.reflow.ocr.controller;

public record ErrorResponse(
    String message,
    String errorCode,
    int status,
    long timestamp
) {}
