package com.exposureplatform.exposure.store;

import com.exposureplatform.common.exception.ExposureException;
import com.exposureplatform.common.model.ExposureStatus;
import com.exposureplatform.exposure.model.ExposureStatusRecord;
import com.exposureplatform.exposure.repository.ExposureStatusRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Owner of the current {@link ExposureStatus}.
 *
 * <p>The value lives in the single {@code exposure_status} row and is mirrored in memory
 * after the first read. {@link #save} writes the row first and updates the mirror only
 * once the write completed, so {@link #current} never returns an uncommitted status.
 *
 * <p>Writes must come from the serialized task queue; reads may come from anywhere.
 */
@Component
public class ExposureStatusStore {

    private static final Logger log = LoggerFactory.getLogger(ExposureStatusStore.class);

    private final ExposureStatusRepository repository;
    private final AtomicReference<ExposureStatus> cell = new AtomicReference<>();

    public ExposureStatusStore(ExposureStatusRepository repository) {
        this.repository = repository;
    }

    public Mono<ExposureStatus> current() {
        ExposureStatus cached = cell.get();
        if (cached != null) {
            return Mono.just(cached);
        }
        return repository.findById(ExposureStatusRecord.SINGLETON_ID)
            .map(ExposureStatusStore::fromRecord)
            .defaultIfEmpty(new ExposureStatus.None())
            .doOnNext(status -> cell.compareAndSet(null, status))
            .onErrorMap(e -> !(e instanceof ExposureException),
                e -> new ExposureException(ExposureException.Store.STATUS, "Failed to read exposure status", e));
    }

    public Mono<ExposureStatus> save(ExposureStatus status) {
        ExposureStatusRecord record = toRecord(status);
        return repository.upsertStatus(record.getKind(), record.getLastExposureDate(),
                record.isAcknowledged(), record.getLastChangeTime())
            .then(Mono.fromCallable(() -> {
                ExposureStatus previous = cell.getAndSet(status);
                log.info("STATUS_SAVED previous={} current={}", previous, status);
                return status;
            }))
            .onErrorMap(e -> !(e instanceof ExposureException),
                e -> new ExposureException(ExposureException.Store.STATUS, "Failed to write exposure status", e));
    }

    static ExposureStatusRecord toRecord(ExposureStatus status) {
        ExposureStatusRecord record = new ExposureStatusRecord();
        record.setId(ExposureStatusRecord.SINGLETON_ID);
        if (status instanceof ExposureStatus.None) {
            record.setKind("NONE");
        } else if (status instanceof ExposureStatus.Exposed exposed) {
            record.setKind("EXPOSED");
            record.setLastExposureDate(TimeMapping.toColumn(exposed.lastExposureDate()));
            record.setAcknowledged(exposed.acknowledged());
        } else if (status instanceof ExposureStatus.Positive positive) {
            record.setKind("POSITIVE");
            record.setLastChangeTime(TimeMapping.toColumn(positive.lastChangeTime()));
        } else {
            throw new IllegalStateException("Unknown exposure status: " + status);
        }
        return record;
    }

    static ExposureStatus fromRecord(ExposureStatusRecord record) {
        String kind = record.getKind() == null ? "" : record.getKind();
        switch (kind) {
            case "NONE":
                return new ExposureStatus.None();
            case "EXPOSED":
                return new ExposureStatus.Exposed(
                    TimeMapping.fromColumn(record.getLastExposureDate()), record.isAcknowledged());
            case "POSITIVE":
                return new ExposureStatus.Positive(TimeMapping.fromColumn(record.getLastChangeTime()));
            default:
                throw new ExposureException(ExposureException.Store.STATUS, "Unknown stored status kind: " + record.getKind());
        }
    }
}
