package com.exposureplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;
import java.util.Objects;

/**
 * Current exposure status of the user. Closed set of three variants.
 *
 * <h3>Variants</h3>
 * <ul>
 *   <li>{@link None}: no qualifying exposure ever recorded.</li>
 *   <li>{@link Exposed}: at least one qualifying exposure; carries the most recent
 *       exposure date and whether the user has viewed it.</li>
 *   <li>{@link Positive}: the user uploaded a confirmed positive diagnosis.</li>
 * </ul>
 *
 * <h3>Transition rules</h3>
 * <ul>
 *   <li>{@code Positive} is absorbing: no check cycle moves the status away from it.</li>
 *   <li>{@code Exposed.lastExposureDate} never decreases across accepted updates.</li>
 *   <li>Only an explicit reset returns the status to {@code None}.</li>
 * </ul>
 *
 * <p>Every transition site checks all three variants and fails on an unknown one.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ExposureStatus.None.class,     name = "NONE"),
    @JsonSubTypes.Type(value = ExposureStatus.Exposed.class,  name = "EXPOSED"),
    @JsonSubTypes.Type(value = ExposureStatus.Positive.class, name = "POSITIVE")
})
public sealed interface ExposureStatus
    permits ExposureStatus.None, ExposureStatus.Exposed, ExposureStatus.Positive {

    /** No qualifying exposure recorded. */
    record None() implements ExposureStatus {}

    /**
     * At least one qualifying exposure.
     *
     * @param lastExposureDate most recent exposure day seen so far
     * @param acknowledged     true once the user has viewed the exposure
     */
    record Exposed(
        @JsonProperty("lastExposureDate") Instant lastExposureDate,
        @JsonProperty("acknowledged")     boolean acknowledged
    ) implements ExposureStatus {

        public Exposed {
            Objects.requireNonNull(lastExposureDate, "lastExposureDate");
        }

        public Exposed(Instant lastExposureDate) {
            this(lastExposureDate, false);
        }

        public Exposed withAcknowledged(boolean value) {
            return new Exposed(lastExposureDate, value);
        }
    }

    /**
     * Confirmed positive diagnosis, uploaded successfully.
     *
     * @param lastChangeTime when the upload succeeded
     */
    record Positive(
        @JsonProperty("lastChangeTime") Instant lastChangeTime
    ) implements ExposureStatus {}
}
