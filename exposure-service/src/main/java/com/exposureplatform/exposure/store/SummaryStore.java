package com.exposureplatform.exposure.store;

import com.exposureplatform.common.model.ExposureSummary;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Durable storage for check-cycle summaries and the small pieces of state that travel
 * with them.
 */
public interface SummaryStore {

    Mono<Void> addSummary(ExposureSummary summary);

    /** All stored summaries, in insertion order. */
    Mono<List<ExposureSummary>> getSummaries();

    Mono<Boolean> hasSummaries();

    Mono<Void> resetSummaries();

    Mono<List<String>> getCountriesOfInterest();

    /** Replaces the whole list. */
    Mono<Void> setCountriesOfInterest(List<String> countryCodes);

    /** @return the last processed key chunk index, or empty if none was recorded */
    Mono<Integer> getLastProcessedChunk();

    Mono<Void> setLastProcessedChunk(int chunk);

    Mono<Void> resetLastProcessedChunk();

    /** @return the date of the last stored check cycle, or empty if none */
    Mono<Instant> getLastSuccessfulCheckDate();

    Mono<Void> setLastSuccessfulCheckDate(Instant date);
}
