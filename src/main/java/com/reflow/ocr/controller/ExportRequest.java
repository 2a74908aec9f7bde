package com.reflow.ocr.controller;

import jakarta.validation.constraints.NotBlank;

public record ExportRequest(
    @NotBlank String format
) {}
