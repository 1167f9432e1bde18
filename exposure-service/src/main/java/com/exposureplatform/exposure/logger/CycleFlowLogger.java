package com.exposureplatform.exposure.logger;

import com.exposureplatform.common.engine.ExposureEvaluation;
import com.exposureplatform.common.trace.CycleContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs the lifecycle of a check cycle or diagnosis upload. Side-effects only.
 *
 * <p>Check-cycle stages, in order: {@link #CYCLE_RECEIVED}, {@link #STATUS_EVALUATED},
 * {@link #STATUS_COMMITTED} (qualifying cycles only), {@link #DETAILS_FETCHED} (notifying
 * cycles only), {@link #SUMMARY_STORED}.
 *
 * <p>Upload stages: {@link #UPLOAD_RECEIVED}, {@link #UPLOAD_PREPARED}, then one of
 * {@link #UPLOAD_ACCEPTED} or {@link #UPLOAD_FAILED}.
 *
 * <pre>
 *     .doOnEach(cycleFlowLogger.stage(CycleFlowLogger.SUMMARY_STORED))
 * </pre>
 */
@Component
public class CycleFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(CycleFlowLogger.class);

    public static final String CYCLE_RECEIVED   = "CYCLE_RECEIVED";
    public static final String STATUS_EVALUATED = "STATUS_EVALUATED";
    public static final String STATUS_COMMITTED = "STATUS_COMMITTED";
    public static final String DETAILS_FETCHED  = "DETAILS_FETCHED";
    public static final String SUMMARY_STORED   = "SUMMARY_STORED";

    public static final String UPLOAD_RECEIVED  = "UPLOAD_RECEIVED";
    public static final String UPLOAD_PREPARED  = "UPLOAD_PREPARED";
    public static final String UPLOAD_ACCEPTED  = "UPLOAD_ACCEPTED";
    public static final String UPLOAD_FAILED    = "UPLOAD_FAILED";

    /**
     * Returns a {@code doOnEach} consumer that logs {@code stageName} on {@code onNext},
     * reading the cycle id from the Reactor Context.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String cycleId = CycleContextUtil.getCycleId(signal.getContextView());
            logWithCycleId(stageName, cycleId);
        };
    }

    public void logWithCycleId(String stageName, String cycleId) {
        CycleContextUtil.withMdc(cycleId, () ->
            log.info("[CycleFlow] stage={} cycleId={}", stageName, cycleId)
        );
    }

    public void logEvaluation(ExposureEvaluation evaluation, String cycleId) {
        CycleContextUtil.withMdc(cycleId, () ->
            log.info("[CycleFlow] stage={} qualifying={} notify={} previous={} next={} "
                     + "matchedKeys={} maxRisk={} cycleId={}",
                     STATUS_EVALUATED,
                     evaluation.qualifying(), evaluation.shouldFetchDetails(),
                     evaluation.previousStatus(), evaluation.newStatus(),
                     evaluation.summary().matchedKeyCount(), evaluation.summary().maximumRiskScore(),
                     cycleId)
        );
    }

    public void logUploadFailure(String reason, String cycleId) {
        CycleContextUtil.withMdc(cycleId, () ->
            log.warn("[CycleFlow] stage={} reason={} cycleId={}", UPLOAD_FAILED, reason, cycleId)
        );
    }
}
