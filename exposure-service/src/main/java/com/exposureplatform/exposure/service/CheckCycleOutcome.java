package com.exposureplatform.exposure.service;

import com.exposureplatform.common.model.ExposureStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of one check cycle.
 *
 * @param status     exposure status after the cycle
 * @param qualifying true if the cycle met the risk thresholds
 * @param notified   true if the cycle raised a user-visible exposure alert
 * @param infoCount  number of per-key details stored with the summary
 */
public record CheckCycleOutcome(
    @JsonProperty("cycleId")    String         cycleId,
    @JsonProperty("status")     ExposureStatus status,
    @JsonProperty("qualifying") boolean        qualifying,
    @JsonProperty("notified")   boolean        notified,
    @JsonProperty("infoCount")  int            infoCount
) {}
