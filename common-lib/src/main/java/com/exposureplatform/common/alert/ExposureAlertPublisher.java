package com.exposureplatform.common.alert;

import com.exposureplatform.common.model.ExposureAlert;

/**
 * Hands an {@link ExposureAlert} to whatever renders user-facing notifications.
 *
 * <p>Current implementation: {@code RestExposureAlertPublisher} : posts the alert to the
 * notification service over HTTP (fire-and-forget WebClient call).
 */
public interface ExposureAlertPublisher {

    /**
     * Publish an exposure alert.
     * Implementations MUST be non-blocking. A delivery failure must never undo or delay
     * the status change that raised the alert.
     *
     * @param alert the alert to deliver
     */
    void publish(ExposureAlert alert);
}
