package io.lapse4j.core;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum JobKind {
    @JsonProperty("capture")
    CAPTURE,
    @JsonProperty("export")
    EXPORT,
    @JsonProperty("render")
    RENDER
}
