package com.exposureplatform.exposure.settings;

import com.exposureplatform.common.model.RiskPolicy;
import com.exposureplatform.exposure.client.ConfigurationSettingsClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Supplies the current {@link RiskPolicy}.
 *
 * <p>Fetch once, serve many: a policy read from the configuration server is reused until
 * {@code exposure.settings.cache-ttl} elapses. When the server cannot be reached, or
 * returns an incomplete document, and no fresh entry exists, the result is an empty
 * {@code Mono}. Callers treat that as "configuration unavailable" and fail closed.
 */
@Component
public class RiskPolicyProvider {

    private static final Logger log = LoggerFactory.getLogger(RiskPolicyProvider.class);

    private final ConfigurationSettingsClient settingsClient;
    private final Duration ttl;
    private final Clock clock;
    private final AtomicReference<CachedRiskPolicy> cached = new AtomicReference<>();

    public RiskPolicyProvider(ConfigurationSettingsClient settingsClient,
                              @Value("${exposure.settings.cache-ttl:PT1H}") Duration ttl) {
        this(settingsClient, ttl, Clock.systemUTC());
    }

    RiskPolicyProvider(ConfigurationSettingsClient settingsClient, Duration ttl, Clock clock) {
        this.settingsClient = settingsClient;
        this.ttl = ttl;
        this.clock = clock;
    }

    public Mono<RiskPolicy> currentPolicy() {
        CachedRiskPolicy entry = cached.get();
        if (entry != null && !isExpired(entry)) {
            return Mono.just(entry.policy());
        }
        return settingsClient.fetchSettings()
            .flatMap(response -> Mono.justOrEmpty(response.toRiskPolicy()))
            .doOnNext(policy -> {
                cached.set(new CachedRiskPolicy(policy, clock.instant()));
                log.info("SETTINGS_REFRESH minimumRiskScore={} maxSummaryCount={} maxInfoCount={}",
                    policy.minimumRiskScore(), policy.maxSummaryCount(), policy.maxInfoCount());
            })
            .switchIfEmpty(Mono.defer(() -> {
                log.warn("Configuration settings incomplete, risk policy unavailable");
                return Mono.empty();
            }))
            .onErrorResume(e -> {
                log.warn("Risk policy unavailable. reason={}", e.getMessage());
                return Mono.empty();
            });
    }

    boolean isExpired(CachedRiskPolicy entry) {
        Instant now = clock.instant();
        return now.isAfter(entry.fetchedAt().plus(ttl));
    }
}
