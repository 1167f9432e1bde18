package com.exposureplatform.exposure.store;

import com.exposureplatform.common.exception.ExposureException;
import com.exposureplatform.common.model.ExposureStatus;
import com.exposureplatform.exposure.model.ExposureStatusRecord;
import com.exposureplatform.exposure.repository.ExposureStatusRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExposureStatusStoreTest {

    private static final Instant EXPOSURE = Instant.parse("2020-06-08T00:00:00Z");

    @Mock
    private ExposureStatusRepository repository;

    private ExposureStatusStore store;

    @BeforeEach
    void setUp() {
        store = new ExposureStatusStore(repository);
    }

    @Test
    @DisplayName("no stored row reads as None")
    void emptyTableIsNone() {
        when(repository.findById(ExposureStatusRecord.SINGLETON_ID)).thenReturn(Mono.empty());

        StepVerifier.create(store.current()).expectNext(new ExposureStatus.None()).verifyComplete();
    }

    @Test
    @DisplayName("stored row is read once, then served from memory")
    void readsRowOnce() {
        ExposureStatusRecord row = new ExposureStatusRecord();
        row.setId(ExposureStatusRecord.SINGLETON_ID);
        row.setKind("EXPOSED");
        row.setLastExposureDate(LocalDateTime.of(2020, 6, 8, 0, 0));
        row.setAcknowledged(true);
        when(repository.findById(ExposureStatusRecord.SINGLETON_ID)).thenReturn(Mono.just(row));

        StepVerifier.create(store.current()).expectNext(new ExposureStatus.Exposed(EXPOSURE, true)).verifyComplete();
        StepVerifier.create(store.current()).expectNext(new ExposureStatus.Exposed(EXPOSURE, true)).verifyComplete();

        verify(repository, times(1)).findById(ExposureStatusRecord.SINGLETON_ID);
    }

    @Test
    @DisplayName("save writes the row before the new value becomes visible")
    void saveThenRead() {
        when(repository.upsertStatus(eq("EXPOSED"), eq(LocalDateTime.of(2020, 6, 8, 0, 0)), eq(false), isNull()))
            .thenReturn(Mono.empty());

        StepVerifier.create(store.save(new ExposureStatus.Exposed(EXPOSURE)))
            .expectNext(new ExposureStatus.Exposed(EXPOSURE))
            .verifyComplete();
        StepVerifier.create(store.current()).expectNext(new ExposureStatus.Exposed(EXPOSURE)).verifyComplete();

        verify(repository, never()).findById(any(Long.class));
    }

    @Test
    @DisplayName("a failed write leaves the previous value in place")
    void failedWriteKeepsPrevious() {
        when(repository.findById(ExposureStatusRecord.SINGLETON_ID)).thenReturn(Mono.empty());
        when(repository.upsertStatus(any(), any(), anyBoolean(), any()))
            .thenReturn(Mono.error(new ExposureException(ExposureException.Store.STATUS, "connection refused")));

        StepVerifier.create(store.current()).expectNext(new ExposureStatus.None()).verifyComplete();
        StepVerifier.create(store.save(new ExposureStatus.Positive(EXPOSURE)))
            .expectError(ExposureException.class)
            .verify();
        StepVerifier.create(store.current()).expectNext(new ExposureStatus.None()).verifyComplete();
    }

    @Test
    @DisplayName("driver errors on write are reported against the status store")
    void driverErrorIsTyped() {
        when(repository.upsertStatus(any(), any(), anyBoolean(), any()))
            .thenReturn(Mono.error(new IllegalStateException("pool exhausted")));

        StepVerifier.create(store.save(new ExposureStatus.None()))
            .expectErrorSatisfies(e -> {
                ExposureException failure = assertInstanceOf(ExposureException.class, e);
                assertEquals(ExposureException.Store.STATUS, failure.getStore());
                assertTrue(failure.affectsStatus());
                assertInstanceOf(IllegalStateException.class, failure.getCause());
            })
            .verify();
    }

    @Test
    @DisplayName("Positive maps to its own kind with the change time")
    void positiveMapping() {
        ExposureStatusRecord record = ExposureStatusStore.toRecord(new ExposureStatus.Positive(EXPOSURE));

        assertEquals("POSITIVE", record.getKind());
        assertEquals(LocalDateTime.of(2020, 6, 8, 0, 0), record.getLastChangeTime());
        assertNull(record.getLastExposureDate());
        assertEquals(new ExposureStatus.Positive(EXPOSURE), ExposureStatusStore.fromRecord(record));
    }

    @Test
    @DisplayName("unknown stored kind is a persistence error")
    void unknownKind() {
        ExposureStatusRecord record = new ExposureStatusRecord();
        record.setKind("QUARANTINED");

        assertThrows(ExposureException.class, () -> ExposureStatusStore.fromRecord(record));
    }
}
