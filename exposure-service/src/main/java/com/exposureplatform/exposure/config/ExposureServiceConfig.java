package com.exposureplatform.exposure.config;

import com.exposureplatform.common.engine.ExposureStatusEngine;
import com.exposureplatform.common.upload.UploadPreparer;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class ExposureServiceConfig {

    @Value("${services.matching-engine.base-url}")
    private String matchingEngineUrl;

    @Value("${services.settings.base-url}")
    private String settingsUrl;

    @Value("${services.ingestion.base-url}")
    private String ingestionUrl;

    @Value("${services.notification.base-url}")
    private String notificationUrl;

    /**
     * Detail and key-history fetches run inside the serialized task queue; a matching engine
     * that accepts the connection and never answers must surface as an error.
     */
    @Bean
    public WebClient matchingEngineWebClient(WebClient.Builder builder) {
        return builder
            .baseUrl(matchingEngineUrl)
            .clientConnector(new ReactorClientHttpConnector(boundedHttpClient(20)))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public WebClient settingsWebClient(WebClient.Builder builder) {
        return builder
            .baseUrl(settingsUrl)
            .clientConnector(new ReactorClientHttpConnector(boundedHttpClient(10)))
            .build();
    }

    /**
     * Upload client with bounded timeouts so a hung ingestion server surfaces as an upload
     * failure instead of holding the serialized task queue.
     */
    @Bean
    public WebClient ingestionWebClient(WebClient.Builder builder) {
        return builder
            .baseUrl(ingestionUrl)
            .clientConnector(new ReactorClientHttpConnector(boundedHttpClient(30)))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public WebClient notificationWebClient(WebClient.Builder builder) {
        return builder.baseUrl(notificationUrl).build();
    }

    @Bean
    public ExposureStatusEngine exposureStatusEngine() {
        return new ExposureStatusEngine();
    }

    @Bean
    public UploadPreparer uploadPreparer() {
        return new UploadPreparer();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    private static HttpClient boundedHttpClient(int responseSeconds) {
        return HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofSeconds(responseSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(responseSeconds, TimeUnit.SECONDS))
            );
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            LoggerFactory.getLogger(ExposureServiceConfig.class)
                .debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
