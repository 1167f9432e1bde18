package com.exposureplatform.exposure.client;

import com.exposureplatform.common.model.ExposureInfo;
import com.exposureplatform.common.model.TemporaryExposureKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Client for the proximity-matching engine.
 *
 * <p>Errors are logged and propagated; the orchestrator decides the fallback for each call.
 */
@Component
public class MatchingEngineClient {

    private static final Logger log = LoggerFactory.getLogger(MatchingEngineClient.class);

    private final WebClient matchingEngineWebClient;

    public MatchingEngineClient(WebClient matchingEngineWebClient) {
        this.matchingEngineWebClient = matchingEngineWebClient;
    }

    /**
     * Fetches the per-key details of the matching run identified by {@code token}.
     * Only called when a check cycle raised a notification.
     */
    public Mono<List<ExposureInfo>> fetchExposureInformation(String token) {
        return matchingEngineWebClient.get()
            .uri("/api/v1/matching/exposure-information?token={token}", token)
            .retrieve()
            .bodyToFlux(ExposureInfo.class)
            .collectList()
            .doOnSuccess(infos -> log.info("Exposure information fetched. token={} count={}",
                token, infos == null ? 0 : infos.size()))
            .doOnError(e -> log.warn("Failed to fetch exposure information. token={}", token, e));
    }

    /**
     * Fetches the device's temporary exposure key history for a diagnosis upload.
     */
    public Mono<List<TemporaryExposureKey>> fetchTekHistory() {
        return matchingEngineWebClient.get()
            .uri("/api/v1/matching/tek-history")
            .retrieve()
            .bodyToFlux(TemporaryExposureKey.class)
            .collectList()
            .doOnSuccess(keys -> log.info("TEK history fetched. count={}", keys == null ? 0 : keys.size()))
            .doOnError(e -> log.warn("Failed to fetch TEK history", e));
    }
}
