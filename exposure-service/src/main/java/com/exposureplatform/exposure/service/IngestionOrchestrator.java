package com.exposureplatform.exposure.service;

import com.exposureplatform.common.alert.ExposureAlertPublisher;
import com.exposureplatform.common.engine.ExposureEvaluation;
import com.exposureplatform.common.engine.ExposureStatusEngine;
import com.exposureplatform.common.model.ExposureAlert;
import com.exposureplatform.common.model.ExposureStatus;
import com.exposureplatform.common.model.ExposureSummary;
import com.exposureplatform.common.model.RawExposureSummary;
import com.exposureplatform.common.model.RiskPolicy;
import com.exposureplatform.common.model.TemporaryExposureKey;
import com.exposureplatform.common.trace.CycleContextUtil;
import com.exposureplatform.common.upload.UploadPreparer;
import com.exposureplatform.common.upload.UploadSummary;
import com.exposureplatform.exposure.client.ExposureIngestionClient;
import com.exposureplatform.exposure.client.MatchingEngineClient;
import com.exposureplatform.exposure.client.dto.IngestionUploadRequest;
import com.exposureplatform.exposure.dto.DiagnosisToken;
import com.exposureplatform.exposure.logger.CycleFlowLogger;
import com.exposureplatform.exposure.queue.SerialTaskQueue;
import com.exposureplatform.exposure.settings.RiskPolicyProvider;
import com.exposureplatform.exposure.store.ExposureStatusStore;
import com.exposureplatform.exposure.store.SummaryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Entry point for everything that reads or changes the exposure status.
 *
 * <p>Check cycles, successful uploads, acknowledge and reset all run on the
 * {@link SerialTaskQueue}, so no two status read-modify-write sequences interleave.
 * The risk policy is resolved before a task is queued; an unavailable policy makes a
 * check cycle non-qualifying and an upload fail.
 *
 * <p>Check-cycle order inside the queue:
 * <ol>
 *   <li>read the current status and evaluate the cycle</li>
 *   <li>qualifying and changed: persist the new status</li>
 *   <li>notify decision fired: fetch per-key details (failure keeps an empty list)</li>
 *   <li>append the summary and record the check date</li>
 *   <li>notify decision fired: publish an {@link ExposureAlert}</li>
 * </ol>
 */
@Service
public class IngestionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(IngestionOrchestrator.class);

    static final int STATUS_WRITE_RETRIES = 2;

    private final ExposureStatusEngine    statusEngine;
    private final UploadPreparer          uploadPreparer;
    private final ExposureStatusStore     statusStore;
    private final SummaryStore            summaryStore;
    private final RiskPolicyProvider      riskPolicyProvider;
    private final MatchingEngineClient    matchingEngineClient;
    private final ExposureIngestionClient ingestionClient;
    private final ExposureAlertPublisher  alertPublisher;
    private final SerialTaskQueue         taskQueue;
    private final CycleFlowLogger         flowLogger;
    private final Duration                matchingTimeout;

    public IngestionOrchestrator(ExposureStatusEngine statusEngine,
                                 UploadPreparer uploadPreparer,
                                 ExposureStatusStore statusStore,
                                 SummaryStore summaryStore,
                                 RiskPolicyProvider riskPolicyProvider,
                                 MatchingEngineClient matchingEngineClient,
                                 ExposureIngestionClient ingestionClient,
                                 ExposureAlertPublisher alertPublisher,
                                 SerialTaskQueue taskQueue,
                                 CycleFlowLogger flowLogger,
                                 @Value("${exposure.matching.timeout:PT30S}") Duration matchingTimeout) {
        this.statusEngine         = statusEngine;
        this.uploadPreparer       = uploadPreparer;
        this.statusStore          = statusStore;
        this.summaryStore         = summaryStore;
        this.riskPolicyProvider   = riskPolicyProvider;
        this.matchingEngineClient = matchingEngineClient;
        this.ingestionClient      = ingestionClient;
        this.alertPublisher       = alertPublisher;
        this.taskQueue            = taskQueue;
        this.flowLogger           = flowLogger;
        this.matchingTimeout      = matchingTimeout;
    }

    // ── check cycle ─────────────────────────────────────────────────────────

    /**
     * Processes one check cycle. Always resolves to an outcome unless persistence fails.
     *
     * @param serverDate server time of the check; null makes the cycle non-qualifying
     * @param raw        summary reported by the matching engine
     * @param token      matching-run token used to fetch per-key details
     */
    public Mono<CheckCycleOutcome> processCheckCycle(Instant serverDate, RawExposureSummary raw, String token) {
        String cycleId = CycleContextUtil.newCheckCycleId();
        Mono<CheckCycleOutcome> pipeline = Mono.just(cycleId)
            .doOnEach(flowLogger.stage(CycleFlowLogger.CYCLE_RECEIVED))
            .flatMap(id -> resolvePolicy())
            .flatMap(policy -> taskQueue.submit("check-cycle",
                () -> runCheckCycle(cycleId, serverDate, raw, token, policy.orElse(null))));
        return CycleContextUtil.withCycleId(pipeline, cycleId);
    }

    private Mono<CheckCycleOutcome> runCheckCycle(String cycleId, Instant serverDate, RawExposureSummary raw,
                                                  String token, RiskPolicy policy) {
        return statusStore.current().flatMap(current -> {
            ExposureEvaluation evaluation = statusEngine.evaluate(serverDate, raw, current, policy);
            flowLogger.logEvaluation(evaluation, cycleId);

            Mono<ExposureStatus> committed = evaluation.qualifying() && !evaluation.newStatus().equals(current)
                ? statusStore.save(evaluation.newStatus())
                    .doOnNext(s -> flowLogger.logWithCycleId(CycleFlowLogger.STATUS_COMMITTED, cycleId))
                : Mono.just(current);

            return committed.flatMap(status ->
                attachDetails(evaluation, token, cycleId)
                    .flatMap(summary -> summaryStore.addSummary(summary)
                        .then(recordCheckDate(summary))
                        .then(Mono.fromCallable(() -> {
                            flowLogger.logWithCycleId(CycleFlowLogger.SUMMARY_STORED, cycleId);
                            if (evaluation.shouldFetchDetails()) {
                                publishAlert(cycleId, status, summary);
                            }
                            return new CheckCycleOutcome(cycleId, status, evaluation.qualifying(),
                                evaluation.shouldFetchDetails(), summary.exposureInfos().size());
                        }))));
        });
    }

    private Mono<ExposureSummary> attachDetails(ExposureEvaluation evaluation, String token, String cycleId) {
        ExposureSummary summary = evaluation.summary();
        if (!evaluation.shouldFetchDetails()) {
            return Mono.just(summary);
        }
        if (token == null || token.isBlank()) {
            log.warn("[CheckCycle] no matching token, storing summary without details. cycleId={}", cycleId);
            return Mono.just(summary);
        }
        return matchingEngineClient.fetchExposureInformation(token)
            .timeout(matchingTimeout)
            .map(summary::withExposureInfos)
            .doOnNext(s -> flowLogger.logWithCycleId(CycleFlowLogger.DETAILS_FETCHED, cycleId))
            .onErrorResume(e -> {
                log.warn("[CheckCycle] detail fetch failed (non-critical), storing summary without details. "
                         + "cycleId={} reason={}", cycleId, e.getMessage());
                return Mono.just(summary);
            });
    }

    private Mono<Void> recordCheckDate(ExposureSummary summary) {
        return summary.date() == null
            ? Mono.empty()
            : summaryStore.setLastSuccessfulCheckDate(summary.date());
    }

    private void publishAlert(String cycleId, ExposureStatus status, ExposureSummary summary) {
        if (!(status instanceof ExposureStatus.Exposed exposed)) {
            log.warn("[CheckCycle] notify decision without Exposed status, alert skipped. cycleId={} status={}",
                cycleId, status);
            return;
        }
        alertPublisher.publish(new ExposureAlert(cycleId, exposed.lastExposureDate(),
            summary.exposureInfos().size(), Instant.now()));
    }

    // ── upload ──────────────────────────────────────────────────────────────

    /**
     * Uploads the key history and the prepared summaries. On acceptance the status becomes
     * {@code Positive} whatever it was; on any failure nothing is changed.
     *
     * <p>If the server accepted the keys but the {@code Positive} status could not be stored
     * (after {@value #STATUS_WRITE_RETRIES} retries), the result is still a success with
     * {@code statusWritePending} set. The caller must not upload again; it should call
     * {@link #confirmPositive()} once storage is back.
     *
     * @throws IllegalArgumentException (as a Mono error) if the token or province is invalid
     */
    public Mono<UploadResult> uploadTeks(DiagnosisToken token, String province) {
        String uploadId = CycleContextUtil.newUploadId();
        Mono<UploadResult> pipeline = Mono.fromRunnable(() -> validateUpload(token, province))
            .then(Mono.just(uploadId))
            .doOnEach(flowLogger.stage(CycleFlowLogger.UPLOAD_RECEIVED))
            .flatMap(id -> resolvePolicy())
            .flatMap(policy -> {
                if (policy.isEmpty()) {
                    flowLogger.logUploadFailure(UploadResult.FailureReason.CONFIGURATION_UNAVAILABLE.name(), uploadId);
                    return Mono.just(UploadResult.failure(UploadResult.FailureReason.CONFIGURATION_UNAVAILABLE));
                }
                return taskQueue.submit("upload", () -> runUpload(uploadId, token, province, policy.get()));
            });
        return CycleContextUtil.withCycleId(pipeline, uploadId);
    }

    private Mono<UploadResult> runUpload(String uploadId, DiagnosisToken token, String province, RiskPolicy policy) {
        return matchingEngineClient.fetchTekHistory()
            .timeout(matchingTimeout)
            .map(Optional::of)
            .onErrorResume(e -> {
                log.warn("[Upload] TEK history unavailable. uploadId={} reason={}", uploadId, e.getMessage());
                return Mono.just(Optional.<List<TemporaryExposureKey>>empty());
            })
            .flatMap(history -> {
                if (history.isEmpty()) {
                    flowLogger.logUploadFailure(UploadResult.FailureReason.TEK_HISTORY_UNAVAILABLE.name(), uploadId);
                    return Mono.just(UploadResult.failure(UploadResult.FailureReason.TEK_HISTORY_UNAVAILABLE));
                }
                return Mono.zip(summaryStore.getSummaries(), summaryStore.getCountriesOfInterest())
                    .flatMap(stored -> submitUpload(uploadId, token, province, policy,
                        history.get(), stored.getT1(), stored.getT2()));
            });
    }

    private Mono<UploadResult> submitUpload(String uploadId, DiagnosisToken token, String province,
                                            RiskPolicy policy, List<TemporaryExposureKey> teks,
                                            List<ExposureSummary> summaries, List<String> countries) {
        List<UploadSummary> prepared = uploadPreparer.prepare(summaries, policy, token.serverDate());
        int infoCount = prepared.stream().mapToInt(s -> s.exposureInfos().size()).sum();
        log.info("[Upload] prepared. stored={} kept={} infos={} teks={} uploadId={}",
            summaries.size(), prepared.size(), infoCount, teks.size(), uploadId);
        flowLogger.logWithCycleId(CycleFlowLogger.UPLOAD_PREPARED, uploadId);

        boolean cun = token.type() == DiagnosisToken.TokenType.CUN;
        IngestionUploadRequest body = new IngestionUploadRequest(
            province,
            teks,
            prepared,
            countries,
            cun ? token.healthInsuranceCard() : null,
            cun ? token.symptomOnsetDate() : null
        );

        return ingestionClient.uploadTeks(token, body).flatMap(accepted -> {
            if (!accepted) {
                flowLogger.logUploadFailure(UploadResult.FailureReason.UPLOAD_REJECTED.name(), uploadId);
                return Mono.just(UploadResult.failure(UploadResult.FailureReason.UPLOAD_REJECTED));
            }
            return statusStore.save(new ExposureStatus.Positive(Instant.now()))
                .retryWhen(Retry.backoff(STATUS_WRITE_RETRIES, Duration.ofMillis(100)))
                .doOnNext(s -> flowLogger.logWithCycleId(CycleFlowLogger.UPLOAD_ACCEPTED, uploadId))
                .thenReturn(UploadResult.success(prepared.size(), infoCount))
                .onErrorResume(e -> {
                    // keys are already on the server; failing the call would invite a duplicate upload
                    log.error("[Upload] accepted by ingestion server but Positive status not persisted. "
                              + "uploadId={}", uploadId, e);
                    return Mono.just(UploadResult.acceptedStatusPending(prepared.size(), infoCount));
                });
        });
    }

    private static void validateUpload(DiagnosisToken token, String province) {
        if (token == null) {
            throw new IllegalArgumentException("token is required");
        }
        token.validate();
        if (province == null || province.isBlank()) {
            throw new IllegalArgumentException("province is required");
        }
    }

    /**
     * Sends a padding upload. Never touches the status.
     */
    public Mono<Boolean> dummyUpload() {
        return ingestionClient.dummyUpload();
    }

    // ── status ──────────────────────────────────────────────────────────────

    public Mono<ExposureStatus> currentStatus() {
        return statusStore.current();
    }

    /**
     * Marks an unacknowledged exposure as seen. Any other status is returned unchanged.
     */
    public Mono<ExposureStatus> acknowledgeExposure() {
        return taskQueue.submit("acknowledge", () -> statusStore.current().flatMap(current -> {
            if (current instanceof ExposureStatus.Exposed exposed && !exposed.acknowledged()) {
                return statusStore.save(exposed.withAcknowledged(true));
            }
            return Mono.just(current);
        }));
    }

    /**
     * Stores {@code Positive} for an upload the ingestion server already accepted, when the
     * status write of {@link #uploadTeks} failed.
     */
    public Mono<ExposureStatus> confirmPositive() {
        return taskQueue.submit("confirm-positive", () -> statusStore.current().flatMap(current ->
            current instanceof ExposureStatus.Positive
                ? Mono.just(current)
                : statusStore.save(new ExposureStatus.Positive(Instant.now()))));
    }

    /**
     * Returns the status to {@code None}. There is no debug override layered over the stored
     * status, so nothing else is cleared.
     */
    public Mono<ExposureStatus> resetExposureStatus() {
        return taskQueue.submit("reset", () -> statusStore.save(new ExposureStatus.None()));
    }

    // ── bookkeeping ─────────────────────────────────────────────────────────

    public Mono<Boolean> hasSummaries() {
        return summaryStore.hasSummaries();
    }

    public Mono<Instant> lastSuccessfulCheckDate() {
        return summaryStore.getLastSuccessfulCheckDate();
    }

    public Mono<List<String>> countriesOfInterest() {
        return summaryStore.getCountriesOfInterest();
    }

    public Mono<List<String>> updateCountriesOfInterest(List<String> countries) {
        return Mono.fromCallable(() -> normalizeCountries(countries))
            .flatMap(normalized -> summaryStore.setCountriesOfInterest(normalized).thenReturn(normalized));
    }

    public Mono<Integer> lastProcessedChunk() {
        return summaryStore.getLastProcessedChunk();
    }

    public Mono<Integer> updateLastProcessedChunk(int chunk) {
        if (chunk < 0) {
            return Mono.error(new IllegalArgumentException("chunk must be >= 0"));
        }
        return summaryStore.setLastProcessedChunk(chunk).thenReturn(chunk);
    }

    /**
     * Clears summaries, last processed chunk and countries of interest. The exposure
     * status is kept.
     */
    public Mono<Void> debugCleanup() {
        return taskQueue.submit("debug-cleanup", () -> summaryStore.resetSummaries()
            .then(summaryStore.resetLastProcessedChunk())
            .then(summaryStore.setCountriesOfInterest(List.of()))
            .doOnSuccess(v -> log.warn("[Debug] ingestion state cleaned up")));
    }

    // ── helpers ─────────────────────────────────────────────────────────────

    private Mono<Optional<RiskPolicy>> resolvePolicy() {
        return riskPolicyProvider.currentPolicy()
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty());
    }

    static List<String> normalizeCountries(List<String> countries) {
        if (countries == null) {
            throw new IllegalArgumentException("countries is required");
        }
        return countries.stream()
            .map(code -> {
                if (code == null || code.isBlank()) {
                    throw new IllegalArgumentException("country code must not be blank");
                }
                return code.trim().toUpperCase(Locale.ROOT);
            })
            .distinct()
            .toList();
    }
}
