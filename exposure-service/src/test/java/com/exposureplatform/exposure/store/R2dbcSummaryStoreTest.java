package com.exposureplatform.exposure.store;

import com.exposureplatform.common.exception.ExposureException;
import com.exposureplatform.common.model.ExposureInfo;
import com.exposureplatform.common.model.ExposureSummary;
import com.exposureplatform.exposure.model.BookkeepingEntry;
import com.exposureplatform.exposure.model.ExposureSummaryRecord;
import com.exposureplatform.exposure.repository.BookkeepingRepository;
import com.exposureplatform.exposure.repository.CountryOfInterestRepository;
import com.exposureplatform.exposure.repository.ExposureSummaryRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class R2dbcSummaryStoreTest {

    @Mock private ExposureSummaryRepository   summaryRepository;
    @Mock private CountryOfInterestRepository countryRepository;
    @Mock private BookkeepingRepository       bookkeepingRepository;

    private R2dbcSummaryStore store;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        store = new R2dbcSummaryStore(summaryRepository, countryRepository, bookkeepingRepository, mapper);
    }

    @Test
    @DisplayName("summary infos are stored as JSON text and read back intact")
    void infosSurviveStorage() {
        ExposureInfo info = new ExposureInfo(Instant.parse("2020-06-08T00:00:00Z"), 30, 55, List.of(20, 10, 0), 4, 42);
        ExposureSummary summary = new ExposureSummary(Instant.parse("2020-06-10T08:30:00Z"),
            Instant.parse("2020-06-08T08:30:00Z"), 2, 42, 20, 10, 0, 60, List.of(info));
        when(summaryRepository.save(any(ExposureSummaryRecord.class)))
            .thenAnswer(inv -> Mono.just(inv.<ExposureSummaryRecord>getArgument(0)));

        StepVerifier.create(store.addSummary(summary)).verifyComplete();

        ArgumentCaptor<ExposureSummaryRecord> saved = ArgumentCaptor.forClass(ExposureSummaryRecord.class);
        verify(summaryRepository).save(saved.capture());
        assertTrue(saved.getValue().getExposureInfos().contains("\"totalRiskScore\":42"));

        when(summaryRepository.findAllInInsertionOrder()).thenReturn(Flux.just(saved.getValue()));
        StepVerifier.create(store.getSummaries())
            .expectNext(List.of(summary))
            .verifyComplete();
    }

    @Test
    @DisplayName("corrupt infos column surfaces as ExposureException")
    void corruptInfos() {
        ExposureSummaryRecord record = new ExposureSummaryRecord();
        record.setId(7L);
        record.setExposureInfos("{not json");
        when(summaryRepository.findAllInInsertionOrder()).thenReturn(Flux.just(record));

        StepVerifier.create(store.getSummaries())
            .expectError(ExposureException.class)
            .verify();
    }

    @Test
    @DisplayName("last processed chunk is read from bookkeeping, empty when unset")
    void lastProcessedChunk() {
        BookkeepingEntry entry = new BookkeepingEntry();
        entry.setEntryKey(BookkeepingEntry.LAST_PROCESSED_CHUNK);
        entry.setEntryValue("41");
        when(bookkeepingRepository.findById(BookkeepingEntry.LAST_PROCESSED_CHUNK))
            .thenReturn(Mono.just(entry))
            .thenReturn(Mono.empty());

        StepVerifier.create(store.getLastProcessedChunk()).expectNext(41).verifyComplete();
        StepVerifier.create(store.getLastProcessedChunk()).verifyComplete();
    }

    @Test
    @DisplayName("replacing countries deletes the old list first")
    void replaceCountries() {
        when(countryRepository.deleteAllCountries()).thenReturn(Mono.empty());
        when(countryRepository.save(any())).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

        StepVerifier.create(store.setCountriesOfInterest(List.of("DE", "FR"))).verifyComplete();

        InOrder order = inOrder(countryRepository);
        order.verify(countryRepository).deleteAllCountries();
        order.verify(countryRepository, times(2)).save(any());
    }
}
