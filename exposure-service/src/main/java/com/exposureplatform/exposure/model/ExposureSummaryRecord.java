package com.exposureplatform.exposure.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One stored check-cycle summary. Rows are only ever inserted or cleared in bulk.
 *
 * <p>{@code exposureInfos} holds the per-key details as a JSON array; {@code "[]"} for
 * cycles that did not raise a notification.
 */
@Data
@NoArgsConstructor
@Table("exposure_summaries")
public class ExposureSummaryRecord {

    @Id
    private Long id;

    private LocalDateTime summaryDate;
    private LocalDateTime lastExposureDate;

    private int matchedKeyCount;
    private int maximumRiskScore;
    private int highRiskAttenuationMinutes;
    private int mediumRiskAttenuationMinutes;
    private int lowRiskAttenuationMinutes;
    private int riskScoreSum;

    private String exposureInfos;

    private LocalDateTime createdAt;
}
