package com.reflow.ocr.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum BlockType {
    @JsonProperty("paragraph") PARAGRAPH,
    @JsonProperty("header") HEADER,
    @JsonProperty("footer") FOOTER,
    @JsonProperty("table") TABLE,
    @JsonProperty("figure") FIGURE
}
