package com.exposureplatform.exposure.dto;

import com.exposureplatform.common.model.RawExposureSummary;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One check cycle as reported by the matching engine.
 * {@code token} identifies the matching run so its per-key details can be fetched later.
 */
public record CheckCycleRequest(
    @JsonProperty("serverDate")                           Instant serverDate,
    @JsonProperty("token")                                String  token,
    @JsonProperty("daysSinceLastExposure")                int     daysSinceLastExposure,
    @JsonProperty("matchedKeyCount")                      int     matchedKeyCount,
    @JsonProperty("maximumRiskScore")                     int     maximumRiskScore,
    @JsonProperty("highRiskAttenuationDurationMinutes")   int     highRiskAttenuationDurationMinutes,
    @JsonProperty("mediumRiskAttenuationDurationMinutes") int     mediumRiskAttenuationDurationMinutes,
    @JsonProperty("lowRiskAttenuationDurationMinutes")    int     lowRiskAttenuationDurationMinutes,
    @JsonProperty("riskScoreSum")                         int     riskScoreSum
) {

    public RawExposureSummary toRawSummary() {
        return new RawExposureSummary(daysSinceLastExposure, matchedKeyCount, maximumRiskScore,
            highRiskAttenuationDurationMinutes, mediumRiskAttenuationDurationMinutes,
            lowRiskAttenuationDurationMinutes, riskScoreSum);
    }
}
