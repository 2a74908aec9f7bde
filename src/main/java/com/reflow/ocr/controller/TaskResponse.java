package com.reflow.ocr.controller;

import java.util.UUID;

public record TaskResponse(
    UUID taskId
) {}
