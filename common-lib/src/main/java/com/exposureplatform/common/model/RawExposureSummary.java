package com.exposureplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Check-cycle summary exactly as the matching engine reports it, before the
 * server date has been applied.
 */
public record RawExposureSummary(
    @JsonProperty("daysSinceLastExposure")                int daysSinceLastExposure,
    @JsonProperty("matchedKeyCount")                      int matchedKeyCount,
    @JsonProperty("maximumRiskScore")                     int maximumRiskScore,
    @JsonProperty("highRiskAttenuationDurationMinutes")   int highRiskAttenuationDurationMinutes,
    @JsonProperty("mediumRiskAttenuationDurationMinutes") int mediumRiskAttenuationDurationMinutes,
    @JsonProperty("lowRiskAttenuationDurationMinutes")    int lowRiskAttenuationDurationMinutes,
    @JsonProperty("riskScoreSum")                         int riskScoreSum
) {

    /**
     * True if any count, score or duration is negative. Such a summary is still
     * recorded but can never affect the exposure status.
     */
    public boolean isDegenerate() {
        return daysSinceLastExposure < 0
            || matchedKeyCount < 0
            || maximumRiskScore < 0
            || highRiskAttenuationDurationMinutes < 0
            || mediumRiskAttenuationDurationMinutes < 0
            || lowRiskAttenuationDurationMinutes < 0
            || riskScoreSum < 0;
    }
}
