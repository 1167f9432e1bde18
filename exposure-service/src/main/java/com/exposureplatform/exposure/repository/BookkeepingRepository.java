package com.exposureplatform.exposure.repository;

import com.exposureplatform.exposure.model.BookkeepingEntry;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface BookkeepingRepository extends ReactiveCrudRepository<BookkeepingEntry, String> {

    @Modifying
    @Query("""
        INSERT INTO exposure_bookkeeping (entry_key, entry_value, updated_at)
        VALUES (:entryKey, :entryValue, NOW())
        ON CONFLICT (entry_key) DO UPDATE SET
            entry_value = :entryValue,
            updated_at  = NOW()
        """)
    Mono<Void> upsertEntry(String entryKey, String entryValue);
}
