package com.reflow.ocr.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum SessionStatus {
    @JsonProperty("draft") DRAFT,
    @JsonProperty("processing") PROCESSING,
    @JsonProperty("ready") READY,
    @JsonProperty("error") ERROR
}
