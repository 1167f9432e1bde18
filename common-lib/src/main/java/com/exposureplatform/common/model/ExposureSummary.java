package com.exposureplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * One record per check cycle. Immutable; stored append-only.
 *
 * <p>{@code exposureInfos} is empty unless the cycle raised a user-visible
 * exposure notification, in which case the per-key details were fetched and
 * attached before the summary was stored.
 */
public record ExposureSummary(
    @JsonProperty("date")                                 Instant            date,
    @JsonProperty("lastExposureDate")                     Instant            lastExposureDate,
    @JsonProperty("matchedKeyCount")                      int                matchedKeyCount,
    @JsonProperty("maximumRiskScore")                     int                maximumRiskScore,
    @JsonProperty("highRiskAttenuationDurationMinutes")   int                highRiskAttenuationDurationMinutes,
    @JsonProperty("mediumRiskAttenuationDurationMinutes") int                mediumRiskAttenuationDurationMinutes,
    @JsonProperty("lowRiskAttenuationDurationMinutes")    int                lowRiskAttenuationDurationMinutes,
    @JsonProperty("riskScoreSum")                         int                riskScoreSum,
    @JsonProperty("exposureInfos")                        List<ExposureInfo> exposureInfos
) {

    public ExposureSummary {
        exposureInfos = exposureInfos == null ? List.of() : List.copyOf(exposureInfos);
    }

    public ExposureSummary withExposureInfos(List<ExposureInfo> infos) {
        return new ExposureSummary(date, lastExposureDate, matchedKeyCount, maximumRiskScore,
            highRiskAttenuationDurationMinutes, mediumRiskAttenuationDurationMinutes,
            lowRiskAttenuationDurationMinutes, riskScoreSum, infos);
    }
}
