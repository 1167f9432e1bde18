package com.exposureplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Detail for a single matched key, as reported by the matching engine.
 * Owned by exactly one {@link ExposureSummary}.
 */
public record ExposureInfo(
    @JsonProperty("date")                  Instant       date,
    @JsonProperty("durationMinutes")       int           durationMinutes,
    @JsonProperty("attenuationValue")      int           attenuationValue,
    @JsonProperty("attenuationDurations")  List<Integer> attenuationDurations,
    @JsonProperty("transmissionRiskLevel") int           transmissionRiskLevel,
    @JsonProperty("totalRiskScore")        int           totalRiskScore
) {

    public ExposureInfo {
        attenuationDurations = attenuationDurations == null ? List.of() : List.copyOf(attenuationDurations);
    }
}
