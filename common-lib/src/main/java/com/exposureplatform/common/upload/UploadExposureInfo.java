package com.exposureplatform.common.upload;

import com.exposureplatform.common.model.ExposureInfo;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Upload representation of an {@link ExposureInfo}. The exposure instant is reduced to its
 * UTC calendar day.
 */
public record UploadExposureInfo(
    @JsonProperty("date")                    LocalDate     date,
    @JsonProperty("duration")                int           durationMinutes,
    @JsonProperty("attenuation_value")       int           attenuationValue,
    @JsonProperty("attenuation_durations")   List<Integer> attenuationDurations,
    @JsonProperty("transmission_risk_level") int           transmissionRiskLevel,
    @JsonProperty("total_risk_score")        int           totalRiskScore
) {

    static UploadExposureInfo from(ExposureInfo info) {
        return new UploadExposureInfo(
            info.date() == null ? null : LocalDate.ofInstant(info.date(), ZoneOffset.UTC),
            info.durationMinutes(),
            info.attenuationValue(),
            info.attenuationDurations(),
            info.transmissionRiskLevel(),
            info.totalRiskScore()
        );
    }
}
