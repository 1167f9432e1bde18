package com.exposureplatform.exposure.store;

import com.exposureplatform.common.exception.ExposureException;
import com.exposureplatform.common.model.ExposureInfo;
import com.exposureplatform.common.model.ExposureSummary;
import com.exposureplatform.exposure.model.BookkeepingEntry;
import com.exposureplatform.exposure.model.CountryOfInterest;
import com.exposureplatform.exposure.model.ExposureSummaryRecord;
import com.exposureplatform.exposure.repository.BookkeepingRepository;
import com.exposureplatform.exposure.repository.CountryOfInterestRepository;
import com.exposureplatform.exposure.repository.ExposureSummaryRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;

/**
 * PostgreSQL-backed {@link SummaryStore} over Spring Data R2DBC.
 */
@Component
public class R2dbcSummaryStore implements SummaryStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcSummaryStore.class);

    private static final TypeReference<List<ExposureInfo>> INFO_LIST = new TypeReference<>() {};

    private final ExposureSummaryRepository   summaryRepository;
    private final CountryOfInterestRepository countryRepository;
    private final BookkeepingRepository       bookkeepingRepository;
    private final ObjectMapper                objectMapper;

    public R2dbcSummaryStore(ExposureSummaryRepository summaryRepository,
                             CountryOfInterestRepository countryRepository,
                             BookkeepingRepository bookkeepingRepository,
                             ObjectMapper objectMapper) {
        this.summaryRepository     = summaryRepository;
        this.countryRepository     = countryRepository;
        this.bookkeepingRepository = bookkeepingRepository;
        this.objectMapper          = objectMapper;
    }

    // ── summaries ───────────────────────────────────────────────────────────

    @Override
    public Mono<Void> addSummary(ExposureSummary summary) {
        return Mono.fromCallable(() -> toRecord(summary))
            .flatMap(summaryRepository::save)
            .doOnNext(saved -> log.debug("Summary stored. id={} infos={}",
                saved.getId(), summary.exposureInfos().size()))
            .then();
    }

    @Override
    public Mono<List<ExposureSummary>> getSummaries() {
        return summaryRepository.findAllInInsertionOrder()
            .map(this::fromRecord)
            .collectList();
    }

    @Override
    public Mono<Boolean> hasSummaries() {
        return summaryRepository.existsAny().defaultIfEmpty(false);
    }

    @Override
    public Mono<Void> resetSummaries() {
        return summaryRepository.deleteAllSummaries()
            .doOnSuccess(v -> log.info("Exposure summaries cleared"));
    }

    // ── countries of interest ───────────────────────────────────────────────

    @Override
    public Mono<List<String>> getCountriesOfInterest() {
        return countryRepository.findAllInInsertionOrder()
            .map(CountryOfInterest::getCountryCode)
            .collectList();
    }

    @Override
    public Mono<Void> setCountriesOfInterest(List<String> countryCodes) {
        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        return countryRepository.deleteAllCountries()
            .thenMany(Flux.fromIterable(countryCodes)
                .map(code -> {
                    CountryOfInterest country = new CountryOfInterest();
                    country.setCountryCode(code);
                    country.setInsertedAt(now);
                    return country;
                })
                .concatMap(countryRepository::save))
            .then()
            .doOnSuccess(v -> log.info("Countries of interest replaced. count={}", countryCodes.size()));
    }

    // ── bookkeeping ─────────────────────────────────────────────────────────

    @Override
    public Mono<Integer> getLastProcessedChunk() {
        return bookkeepingRepository.findById(BookkeepingEntry.LAST_PROCESSED_CHUNK)
            .map(entry -> parse(entry, Integer::valueOf));
    }

    @Override
    public Mono<Void> setLastProcessedChunk(int chunk) {
        return bookkeepingRepository.upsertEntry(BookkeepingEntry.LAST_PROCESSED_CHUNK, String.valueOf(chunk));
    }

    @Override
    public Mono<Void> resetLastProcessedChunk() {
        return bookkeepingRepository.deleteById(BookkeepingEntry.LAST_PROCESSED_CHUNK);
    }

    @Override
    public Mono<Instant> getLastSuccessfulCheckDate() {
        return bookkeepingRepository.findById(BookkeepingEntry.LAST_SUCCESSFUL_CHECK_DATE)
            .map(entry -> parse(entry, Instant::parse));
    }

    @Override
    public Mono<Void> setLastSuccessfulCheckDate(Instant date) {
        return bookkeepingRepository.upsertEntry(BookkeepingEntry.LAST_SUCCESSFUL_CHECK_DATE, date.toString());
    }

    // ── mapping ─────────────────────────────────────────────────────────────

    ExposureSummaryRecord toRecord(ExposureSummary summary) {
        ExposureSummaryRecord record = new ExposureSummaryRecord();
        record.setSummaryDate(TimeMapping.toColumn(summary.date()));
        record.setLastExposureDate(TimeMapping.toColumn(summary.lastExposureDate()));
        record.setMatchedKeyCount(summary.matchedKeyCount());
        record.setMaximumRiskScore(summary.maximumRiskScore());
        record.setHighRiskAttenuationMinutes(summary.highRiskAttenuationDurationMinutes());
        record.setMediumRiskAttenuationMinutes(summary.mediumRiskAttenuationDurationMinutes());
        record.setLowRiskAttenuationMinutes(summary.lowRiskAttenuationDurationMinutes());
        record.setRiskScoreSum(summary.riskScoreSum());
        record.setCreatedAt(LocalDateTime.now(ZoneOffset.UTC));
        try {
            record.setExposureInfos(objectMapper.writeValueAsString(summary.exposureInfos()));
        } catch (JsonProcessingException e) {
            throw new ExposureException(ExposureException.Store.SUMMARIES, "Failed to serialize exposure infos", e);
        }
        return record;
    }

    ExposureSummary fromRecord(ExposureSummaryRecord record) {
        List<ExposureInfo> infos;
        try {
            infos = record.getExposureInfos() == null
                ? List.of()
                : objectMapper.readValue(record.getExposureInfos(), INFO_LIST);
        } catch (JsonProcessingException e) {
            throw new ExposureException(ExposureException.Store.SUMMARIES,
                "Failed to deserialize exposure infos for summary id=" + record.getId(), e);
        }
        return new ExposureSummary(
            TimeMapping.fromColumn(record.getSummaryDate()),
            TimeMapping.fromColumn(record.getLastExposureDate()),
            record.getMatchedKeyCount(),
            record.getMaximumRiskScore(),
            record.getHighRiskAttenuationMinutes(),
            record.getMediumRiskAttenuationMinutes(),
            record.getLowRiskAttenuationMinutes(),
            record.getRiskScoreSum(),
            infos
        );
    }

    private static <T> T parse(BookkeepingEntry entry, Function<String, T> parser) {
        try {
            return parser.apply(entry.getEntryValue());
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new ExposureException(ExposureException.Store.SUMMARIES,
                "Corrupt bookkeeping value. key=" + entry.getEntryKey(), e);
        }
    }
}
