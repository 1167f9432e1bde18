package com.exposureplatform.exposure.repository;

import com.exposureplatform.exposure.model.ExposureSummaryRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface ExposureSummaryRepository extends ReactiveCrudRepository<ExposureSummaryRecord, Long> {

    /** Insertion order; upload preparation does its own date sort. */
    @Query("SELECT * FROM exposure_summaries ORDER BY id ASC")
    Flux<ExposureSummaryRecord> findAllInInsertionOrder();

    @Query("SELECT EXISTS (SELECT 1 FROM exposure_summaries)")
    Mono<Boolean> existsAny();

    @Modifying
    @Query("DELETE FROM exposure_summaries")
    Mono<Void> deleteAllSummaries();
}
