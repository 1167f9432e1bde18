package com.exposureplatform.exposure.client;

import com.exposureplatform.exposure.client.dto.IngestionUploadRequest;
import com.exposureplatform.exposure.dto.DiagnosisToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Transport to the ingestion server.
 *
 * <p>Both operations resolve to a boolean: {@code true} when the server accepted the
 * request, {@code false} on any rejection or transport failure. No exception escapes.
 */
@Component
public class ExposureIngestionClient {

    private static final Logger log = LoggerFactory.getLogger(ExposureIngestionClient.class);

    static final String UPLOAD_PATH       = "/v1/ingestion/upload";
    static final String TOKEN_TYPE_HEADER = "X-Token-Type";
    static final String DUMMY_HEADER      = "X-Dummy-Data";

    private final WebClient ingestionWebClient;

    public ExposureIngestionClient(WebClient ingestionWebClient) {
        this.ingestionWebClient = ingestionWebClient;
    }

    public Mono<Boolean> uploadTeks(DiagnosisToken token, IngestionUploadRequest body) {
        return ingestionWebClient.post()
            .uri(UPLOAD_PATH)
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + token.value())
            .header(TOKEN_TYPE_HEADER, token.type().name())
            .bodyValue(body)
            .retrieve()
            .toBodilessEntity()
            .map(response -> response.getStatusCode().is2xxSuccessful())
            .doOnNext(accepted -> log.info("Diagnosis upload completed. tokenType={} accepted={} summaries={} teks={}",
                token.type(), accepted, body.exposureDetectionSummaries().size(), body.teks().size()))
            .onErrorResume(e -> {
                log.warn("Diagnosis upload failed. tokenType={} reason={}", token.type(), e.getMessage());
                return Mono.just(false);
            });
    }

    /**
     * Sends a padding request that the server discards, so real uploads cannot be told
     * apart from background traffic.
     */
    public Mono<Boolean> dummyUpload() {
        return ingestionWebClient.post()
            .uri(UPLOAD_PATH)
            .header(DUMMY_HEADER, "1")
            .bodyValue(IngestionUploadRequest.dummy())
            .retrieve()
            .toBodilessEntity()
            .map(response -> response.getStatusCode().is2xxSuccessful())
            .doOnNext(accepted -> log.debug("Dummy upload completed. accepted={}", accepted))
            .onErrorResume(e -> {
                log.warn("Dummy upload failed (non-critical). reason={}", e.getMessage());
                return Mono.just(false);
            });
    }
}
