package com.exposureplatform.exposure.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ProcessedChunkRequest(
    @JsonProperty("chunk") int chunk
) {}
