package com.exposureplatform.common.upload;

import com.exposureplatform.common.model.ExposureSummary;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Upload representation of an {@link ExposureSummary}.
 *
 * <p>{@code daysSinceLastExposure} is measured against the server date attached to the
 * diagnosis token, not against the original check date.
 */
public record UploadSummary(
    @JsonProperty("date")                     LocalDate                date,
    @JsonProperty("matched_key_count")        int                      matchedKeyCount,
    @JsonProperty("days_since_last_exposure") int                      daysSinceLastExposure,
    @JsonProperty("attenuation_durations")    List<Integer>            attenuationDurations,
    @JsonProperty("maximum_risk_score")       int                      maximumRiskScore,
    @JsonProperty("risk_score_sum")           int                      riskScoreSum,
    @JsonProperty("exposure_info")            List<UploadExposureInfo> exposureInfos
) {

    public UploadSummary {
        attenuationDurations = attenuationDurations == null ? List.of() : List.copyOf(attenuationDurations);
        exposureInfos = exposureInfos == null ? List.of() : List.copyOf(exposureInfos);
    }

    /**
     * Converts a stored summary, stamping it with the upload server date.
     */
    static UploadSummary from(ExposureSummary summary, Instant uploadServerDate) {
        return new UploadSummary(
            summary.date() == null ? null : LocalDate.ofInstant(summary.date(), ZoneOffset.UTC),
            summary.matchedKeyCount(),
            daysBetween(summary.lastExposureDate(), uploadServerDate),
            List.of(summary.highRiskAttenuationDurationMinutes(),
                    summary.mediumRiskAttenuationDurationMinutes(),
                    summary.lowRiskAttenuationDurationMinutes()),
            summary.maximumRiskScore(),
            summary.riskScoreSum(),
            summary.exposureInfos().stream().map(UploadExposureInfo::from).toList()
        );
    }

    private static int daysBetween(Instant from, Instant to) {
        if (from == null || to == null) return 0;
        return (int) Math.max(0, ChronoUnit.DAYS.between(from, to));
    }
}
