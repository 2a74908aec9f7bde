package com.reflow.ocr.controller;

import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.UUID;

public record PageOrderRequest(
    @NotNull List<UUID> order
) {}
