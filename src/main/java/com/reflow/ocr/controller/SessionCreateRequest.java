package com.reflow.ocr.controller;

import jakarta.validation.constraints.Size;

public record SessionCreateRequest(
    @Size(max = 200) String name,
    @Size(max = 2000) String description
) {}
