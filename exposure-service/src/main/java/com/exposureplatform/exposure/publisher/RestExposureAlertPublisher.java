package com.exposureplatform.exposure.publisher;

import com.exposureplatform.common.alert.ExposureAlertPublisher;
import com.exposureplatform.common.model.ExposureAlert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * REST implementation of {@link ExposureAlertPublisher}.
 *
 * <p>Posts the alert to the notification service and returns immediately. A failed
 * delivery is logged and dropped; the exposure status is already committed by then.
 */
@Component
public class RestExposureAlertPublisher implements ExposureAlertPublisher {

    private static final Logger log = LoggerFactory.getLogger(RestExposureAlertPublisher.class);

    private final WebClient notificationWebClient;
    private final boolean enabled;

    public RestExposureAlertPublisher(WebClient notificationWebClient,
                                      @Value("${exposure.notification.enabled:true}") boolean enabled) {
        this.notificationWebClient = notificationWebClient;
        this.enabled = enabled;
    }

    @Override
    public void publish(ExposureAlert alert) {
        if (!enabled) {
            log.debug("Exposure alert suppressed (notifications disabled). cycleId={}", alert.cycleId());
            return;
        }
        notificationWebClient.post()
            .uri("/api/v1/notify/exposure")
            .header("X-Cycle-Id", alert.cycleId())
            .bodyValue(alert)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Exposure alert published. cycleId={} lastExposureDate={} status={}",
                                alert.cycleId(), alert.lastExposureDate(), r.getStatusCode()),
                err -> log.warn("Exposure alert publish failed (non-critical). cycleId={}",
                                alert.cycleId(), err)
            );
    }
}
