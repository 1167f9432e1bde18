package com.exposureplatform.exposure.client.dto;

import com.exposureplatform.common.model.RiskPolicy;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/**
 * Subset of the configuration server's settings document used by this service.
 * Unknown settings are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConfigurationSettingsResponse(
    @JsonProperty("exposure_info_minimum_risk_score") Integer exposureInfoMinimumRiskScore,
    @JsonProperty("teks_max_summary_count")           Integer teksMaxSummaryCount,
    @JsonProperty("teks_max_info_count")              Integer teksMaxInfoCount
) {

    /**
     * @return the risk policy, or empty if any of the three values is missing
     */
    public Optional<RiskPolicy> toRiskPolicy() {
        if (exposureInfoMinimumRiskScore == null || teksMaxSummaryCount == null || teksMaxInfoCount == null) {
            return Optional.empty();
        }
        return Optional.of(new RiskPolicy(exposureInfoMinimumRiskScore, teksMaxSummaryCount, teksMaxInfoCount));
    }
}
