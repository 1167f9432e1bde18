package com.exposureplatform.exposure.service;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a diagnosis upload. A failed upload leaves status and history untouched.
 *
 * @param statusWritePending true when the ingestion server accepted the keys but the
 *                           {@code Positive} status is not stored yet; never upload again
 *                           in that case, confirm the status instead
 */
public record UploadResult(
    @JsonProperty("success")            boolean       success,
    @JsonProperty("failureReason")      FailureReason failureReason,
    @JsonProperty("summaryCount")       int           summaryCount,
    @JsonProperty("infoCount")          int           infoCount,
    @JsonProperty("statusWritePending") boolean       statusWritePending
) {

    public enum FailureReason {
        CONFIGURATION_UNAVAILABLE,
        TEK_HISTORY_UNAVAILABLE,
        UPLOAD_REJECTED
    }

    public static UploadResult success(int summaryCount, int infoCount) {
        return new UploadResult(true, null, summaryCount, infoCount, false);
    }

    public static UploadResult acceptedStatusPending(int summaryCount, int infoCount) {
        return new UploadResult(true, null, summaryCount, infoCount, true);
    }

    public static UploadResult failure(FailureReason reason) {
        return new UploadResult(false, reason, 0, 0, false);
    }
}
