package com.exposureplatform.exposure.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@Table("countries_of_interest")
public class CountryOfInterest {

    @Id
    private Long id;

    private String countryCode;
    private LocalDateTime insertedAt;
}
