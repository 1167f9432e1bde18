package com.exposureplatform.common.engine;

import com.exposureplatform.common.model.ExposureStatus;
import com.exposureplatform.common.model.ExposureSummary;
import com.exposureplatform.common.model.RawExposureSummary;
import com.exposureplatform.common.model.RiskPolicy;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Pure logic class. Turns one check-cycle summary into the next exposure status
 * and decides whether the user must be notified.
 *
 * <p>No WebClient. No repositories. No logging. No reactive types.
 *
 * <h3>Evaluation steps</h3>
 * <ol>
 *   <li>Derive {@code lastExposureDate = serverDate − daysSinceLastExposure} (whole days)
 *       and build a summary with no infos.</li>
 *   <li>Qualification: {@code matchedKeyCount > 0} and
 *       {@code maximumRiskScore ≥ minimumRiskScore}. A missing policy, a missing server
 *       date or a degenerate summary never qualifies.</li>
 *   <li>Status transition (qualifying only): {@code Positive} stays, {@code Exposed} keeps
 *       the later of the two dates, {@code None} becomes {@code Exposed}.</li>
 *   <li>Notification trigger: see {@link #shouldNotify}.</li>
 * </ol>
 */
public final class ExposureStatusEngine {

    /**
     * Evaluates a check cycle.
     *
     * @param serverDate    server-reported time of the check; null is treated as malformed
     * @param raw           summary reported by the matching engine
     * @param currentStatus status before this cycle
     * @param policy        current risk policy, or null when configuration is unavailable
     * @return the summary to append and the status decision; never null
     */
    public ExposureEvaluation evaluate(Instant serverDate,
                                       RawExposureSummary raw,
                                       ExposureStatus currentStatus,
                                       RiskPolicy policy) {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(currentStatus, "currentStatus");

        ExposureSummary summary = buildSummary(serverDate, raw);

        if (!isQualifying(summary, raw, policy)) {
            return new ExposureEvaluation(summary, currentStatus, currentStatus, false, false);
        }

        ExposureStatus newStatus = computeStatus(summary, currentStatus);
        return new ExposureEvaluation(summary, currentStatus, newStatus, true,
            shouldNotify(currentStatus, newStatus));
    }

    /**
     * True only for a first-ever exposure ({@code None → Exposed}) or an exposure with a
     * strictly more recent date ({@code Exposed → Exposed}). Never true for a transition
     * touching {@code Positive}.
     */
    public static boolean shouldNotify(ExposureStatus oldStatus, ExposureStatus newStatus) {
        if (oldStatus instanceof ExposureStatus.None && newStatus instanceof ExposureStatus.Exposed) {
            return true;
        }
        if (oldStatus instanceof ExposureStatus.Exposed oldExposed
            && newStatus instanceof ExposureStatus.Exposed newExposed) {
            return newExposed.lastExposureDate().isAfter(oldExposed.lastExposureDate());
        }
        return false;
    }

    // ── Steps ──────────────────────────────────────────────────────────────

    static ExposureSummary buildSummary(Instant serverDate, RawExposureSummary raw) {
        Instant lastExposureDate = serverDate == null
            ? null
            : serverDate.minus(raw.daysSinceLastExposure(), ChronoUnit.DAYS);

        return new ExposureSummary(
            serverDate,
            lastExposureDate,
            raw.matchedKeyCount(),
            raw.maximumRiskScore(),
            raw.highRiskAttenuationDurationMinutes(),
            raw.mediumRiskAttenuationDurationMinutes(),
            raw.lowRiskAttenuationDurationMinutes(),
            raw.riskScoreSum(),
            null
        );
    }

    static boolean isQualifying(ExposureSummary summary, RawExposureSummary raw, RiskPolicy policy) {
        if (policy == null || summary.date() == null || raw.isDegenerate()) {
            return false;
        }
        return summary.matchedKeyCount() > 0
            && summary.maximumRiskScore() >= policy.minimumRiskScore();
    }

    static ExposureStatus computeStatus(ExposureSummary summary, ExposureStatus oldStatus) {
        if (oldStatus instanceof ExposureStatus.Positive) {
            return oldStatus;
        }
        if (oldStatus instanceof ExposureStatus.Exposed exposed) {
            Instant latest = summary.lastExposureDate().isAfter(exposed.lastExposureDate())
                ? summary.lastExposureDate()
                : exposed.lastExposureDate();
            // acknowledged carries over even when the date moves forward
            return new ExposureStatus.Exposed(latest, exposed.acknowledged());
        }
        if (oldStatus instanceof ExposureStatus.None) {
            return new ExposureStatus.Exposed(summary.lastExposureDate(), false);
        }
        throw new IllegalStateException("Unhandled exposure status: " + oldStatus);
    }
}
