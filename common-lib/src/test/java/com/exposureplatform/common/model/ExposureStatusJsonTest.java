package com.exposureplatform.common.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The status travels over REST as a tagged object; the tag must survive a read.
 */
class ExposureStatusJsonTest {

    private final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Test
    @DisplayName("Exposed is written with its type tag and ISO date")
    void exposedHasTag() throws Exception {
        JsonNode node = mapper.valueToTree(
            new ExposureStatus.Exposed(Instant.parse("2020-06-01T10:00:00Z"), true));

        assertEquals("EXPOSED", node.get("type").asText());
        assertEquals("2020-06-01T10:00:00Z", node.get("lastExposureDate").asText());
        assertTrue(node.get("acknowledged").asBoolean());
    }

    @Test
    @DisplayName("type tag selects the variant on read")
    void readsVariantFromTag() throws Exception {
        ExposureStatus none = mapper.readValue("{\"type\":\"NONE\"}", ExposureStatus.class);
        ExposureStatus positive = mapper.readValue(
            "{\"type\":\"POSITIVE\",\"lastChangeTime\":\"2020-06-02T00:00:00Z\"}", ExposureStatus.class);

        assertInstanceOf(ExposureStatus.None.class, none);
        assertEquals(new ExposureStatus.Positive(Instant.parse("2020-06-02T00:00:00Z")), positive);
    }
}
