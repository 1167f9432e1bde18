package com.exposureplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Configuration snapshot used for a single check cycle or upload.
 *
 * @param minimumRiskScore summaries whose maximum risk score is below this value never
 *                         start or extend an exposure
 * @param maxSummaryCount  maximum number of summaries included in an upload
 * @param maxInfoCount     maximum number of exposure infos, across all summaries, included
 *                         in an upload
 */
public record RiskPolicy(
    @JsonProperty("minimumRiskScore") int minimumRiskScore,
    @JsonProperty("maxSummaryCount")  int maxSummaryCount,
    @JsonProperty("maxInfoCount")     int maxInfoCount
) {}
