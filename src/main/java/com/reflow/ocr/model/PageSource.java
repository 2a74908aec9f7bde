package com.reflow.ocr.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum PageSource {
    @JsonProperty("file") FILE,
    @JsonProperty("import") IMPORT
}
