package com.exposureplatform.exposure.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Single-row table holding the current exposure status.
 * {@code kind} is one of NONE, EXPOSED, POSITIVE; the other columns are set per kind.
 */
@Data
@NoArgsConstructor
@Table("exposure_status")
public class ExposureStatusRecord {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    private String kind;
    private LocalDateTime lastExposureDate;
    private boolean acknowledged;
    private LocalDateTime lastChangeTime;
}
