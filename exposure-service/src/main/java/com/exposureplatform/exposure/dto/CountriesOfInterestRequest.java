package com.exposureplatform.exposure.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record CountriesOfInterestRequest(
    @JsonProperty("countries") List<String> countries
) {}
