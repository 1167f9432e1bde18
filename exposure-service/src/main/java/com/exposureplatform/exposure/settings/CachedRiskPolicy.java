package com.exposureplatform.exposure.settings;

import com.exposureplatform.common.model.RiskPolicy;

import java.time.Instant;

/**
 * Last risk policy read from the configuration server, with its fetch time.
 */
public record CachedRiskPolicy(
    RiskPolicy policy,
    Instant fetchedAt
) {}
