package com.exposureplatform.exposure.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UploadRequest(
    @JsonProperty("token")    DiagnosisToken token,
    @JsonProperty("province") String         province
) {}
