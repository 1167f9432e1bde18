package com.exposureplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Raised when a check cycle produces a first exposure or a strictly more recent one.
 * Handed to the notification service for rendering.
 */
public record ExposureAlert(
    @JsonProperty("cycleId")           String  cycleId,
    @JsonProperty("lastExposureDate")  Instant lastExposureDate,
    @JsonProperty("exposureInfoCount") int     exposureInfoCount,
    @JsonProperty("raisedAt")          Instant raisedAt
) {}
