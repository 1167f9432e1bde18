package com.exposureplatform.exposure.client.dto;

import com.exposureplatform.common.model.TemporaryExposureKey;
import com.exposureplatform.common.upload.UploadSummary;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * Body of the diagnosis upload sent to the ingestion server.
 * CUN uploads also carry the health insurance card fragment and symptom onset date.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IngestionUploadRequest(
    @JsonProperty("province")                     String                     province,
    @JsonProperty("teks")                         List<TemporaryExposureKey> teks,
    @JsonProperty("exposure_detection_summaries") List<UploadSummary>        exposureDetectionSummaries,
    @JsonProperty("countries_of_interest")        List<String>               countriesOfInterest,
    @JsonProperty("health_insurance_card")        String                     healthInsuranceCard,
    @JsonProperty("symptoms_started_on")          LocalDate                  symptomOnsetDate
) {

    /** Padding request body: same shape, no data. */
    public static IngestionUploadRequest dummy() {
        return new IngestionUploadRequest(null, List.of(), List.of(), List.of(), null, null);
    }
}
