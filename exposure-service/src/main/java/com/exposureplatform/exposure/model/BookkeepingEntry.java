package com.exposureplatform.exposure.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Key/value row for small pieces of ingestion state.
 */
@Data
@NoArgsConstructor
@Table("exposure_bookkeeping")
public class BookkeepingEntry {

    public static final String LAST_PROCESSED_CHUNK       = "last_processed_chunk";
    public static final String LAST_SUCCESSFUL_CHECK_DATE = "last_successful_check_date";

    @Id
    private String entryKey;

    private String entryValue;
    private LocalDateTime updatedAt;
}
