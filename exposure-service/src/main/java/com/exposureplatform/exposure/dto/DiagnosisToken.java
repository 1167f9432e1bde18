package com.exposureplatform.exposure.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Authorisation for a diagnosis upload.
 *
 * @param type               OTP (one-time password issued by a health operator) or
 *                           CUN (code issued with a positive test result)
 * @param value              the code itself, sent as a bearer token
 * @param serverDate         server time when the token was validated; stamps the upload
 * @param healthInsuranceCard last digits of the health insurance card, CUN only
 * @param symptomOnsetDate   symptom onset date, CUN only, optional
 */
public record DiagnosisToken(
    @JsonProperty("type")                TokenType type,
    @JsonProperty("value")               String    value,
    @JsonProperty("serverDate")          Instant   serverDate,
    @JsonProperty("healthInsuranceCard") String    healthInsuranceCard,
    @JsonProperty("symptomOnsetDate")    LocalDate symptomOnsetDate
) {

    public enum TokenType { OTP, CUN }

    /**
     * @throws IllegalArgumentException if the token cannot authorise an upload
     */
    public void validate() {
        if (type == null) {
            throw new IllegalArgumentException("token type is required");
        }
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("token value is required");
        }
        if (serverDate == null) {
            throw new IllegalArgumentException("token serverDate is required");
        }
        if (type == TokenType.CUN && (healthInsuranceCard == null || healthInsuranceCard.isBlank())) {
            throw new IllegalArgumentException("healthInsuranceCard is required for CUN tokens");
        }
    }
}
