package com.exposureplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A diagnosis key from the device's key history, uploaded verbatim on a positive diagnosis.
 */
public record TemporaryExposureKey(
    @JsonProperty("key_data")                      String keyData,
    @JsonProperty("rolling_start_interval_number") int    rollingStartIntervalNumber,
    @JsonProperty("rolling_period")                int    rollingPeriod,
    @JsonProperty("transmission_risk_level")       int    transmissionRiskLevel
) {}
