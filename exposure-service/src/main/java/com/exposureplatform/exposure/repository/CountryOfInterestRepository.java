package com.exposureplatform.exposure.repository;

import com.exposureplatform.exposure.model.CountryOfInterest;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface CountryOfInterestRepository extends ReactiveCrudRepository<CountryOfInterest, Long> {

    @Query("SELECT * FROM countries_of_interest ORDER BY id ASC")
    Flux<CountryOfInterest> findAllInInsertionOrder();

    @Modifying
    @Query("DELETE FROM countries_of_interest")
    Mono<Void> deleteAllCountries();
}
