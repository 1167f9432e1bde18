package com.exposureplatform.exposure.repository;

import com.exposureplatform.exposure.model.ExposureStatusRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface ExposureStatusRepository extends ReactiveCrudRepository<ExposureStatusRecord, Long> {

    /**
     * Atomic UPSERT of the single status row ({@code id = 1}).
     *
     * @param kind             NONE, EXPOSED or POSITIVE
     * @param lastExposureDate set for EXPOSED, else null
     * @param acknowledged     meaningful for EXPOSED only
     * @param lastChangeTime   set for POSITIVE, else null
     */
    @Modifying
    @Query("""
        INSERT INTO exposure_status
            (id, kind, last_exposure_date, acknowledged, last_change_time)
        VALUES
            (1, :kind, :lastExposureDate, :acknowledged, :lastChangeTime)
        ON CONFLICT (id) DO UPDATE SET
            kind               = :kind,
            last_exposure_date = :lastExposureDate,
            acknowledged       = :acknowledged,
            last_change_time   = :lastChangeTime
        """)
    Mono<Void> upsertStatus(String kind, LocalDateTime lastExposureDate,
                            boolean acknowledged, LocalDateTime lastChangeTime);
}
