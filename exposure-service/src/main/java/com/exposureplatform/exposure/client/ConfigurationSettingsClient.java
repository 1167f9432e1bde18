package com.exposureplatform.exposure.client;

import com.exposureplatform.exposure.client.dto.ConfigurationSettingsResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Read-only client for the configuration server.
 */
@Component
public class ConfigurationSettingsClient {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationSettingsClient.class);

    private final WebClient settingsWebClient;

    public ConfigurationSettingsClient(WebClient settingsWebClient) {
        this.settingsWebClient = settingsWebClient;
    }

    public Mono<ConfigurationSettingsResponse> fetchSettings() {
        return settingsWebClient.get()
            .uri("/v1/settings")
            .retrieve()
            .bodyToMono(ConfigurationSettingsResponse.class)
            .doOnError(e -> log.warn("Failed to fetch configuration settings. reason={}", e.getMessage()));
    }
}
