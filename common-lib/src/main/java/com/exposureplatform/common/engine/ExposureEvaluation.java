package com.exposureplatform.common.engine;

import com.exposureplatform.common.model.ExposureStatus;
import com.exposureplatform.common.model.ExposureSummary;

/**
 * Result of one {@link ExposureStatusEngine#evaluate} call.
 *
 * @param summary            summary to append, always with an empty info list
 * @param previousStatus     status read before the evaluation
 * @param newStatus          status to persist when {@code qualifying} is true
 * @param qualifying         true if the summary met the match-count and risk thresholds
 * @param shouldFetchDetails true if the notification trigger fired; the caller commits
 *                           {@code newStatus} before fetching per-key details
 */
public record ExposureEvaluation(
    ExposureSummary summary,
    ExposureStatus  previousStatus,
    ExposureStatus  newStatus,
    boolean         qualifying,
    boolean         shouldFetchDetails
) {}
