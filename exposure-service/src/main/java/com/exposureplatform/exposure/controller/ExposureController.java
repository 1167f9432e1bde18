package com.exposureplatform.exposure.controller;

import com.exposureplatform.common.model.ExposureStatus;
import com.exposureplatform.exposure.dto.CheckCycleRequest;
import com.exposureplatform.exposure.dto.CountriesOfInterestRequest;
import com.exposureplatform.exposure.dto.ProcessedChunkRequest;
import com.exposureplatform.exposure.dto.UploadRequest;
import com.exposureplatform.exposure.service.CheckCycleOutcome;
import com.exposureplatform.exposure.service.IngestionOrchestrator;
import com.exposureplatform.exposure.service.UploadResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/exposure")
public class ExposureController {

    private final IngestionOrchestrator orchestrator;

    public ExposureController(IngestionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/check-cycle")
    public Mono<ResponseEntity<CheckCycleOutcome>> checkCycle(@RequestBody CheckCycleRequest request) {
        return orchestrator.processCheckCycle(request.serverDate(), request.toRawSummary(), request.token())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/status")
    public Mono<ResponseEntity<ExposureStatus>> status() {
        return orchestrator.currentStatus().map(ResponseEntity::ok);
    }

    @PostMapping("/status/acknowledge")
    public Mono<ResponseEntity<ExposureStatus>> acknowledge() {
        return orchestrator.acknowledgeExposure().map(ResponseEntity::ok);
    }

    /**
     * Back to {@code None}. Unlike the mobile client this service keeps no mock status for
     * debugging, so the stored status is the only thing reset.
     */
    @PostMapping("/status/reset")
    public Mono<ResponseEntity<ExposureStatus>> reset() {
        return orchestrator.resetExposureStatus().map(ResponseEntity::ok);
    }

    /** Follow-up for an upload answered with {@code statusWritePending = true}. */
    @PostMapping("/status/confirm-positive")
    public Mono<ResponseEntity<ExposureStatus>> confirmPositive() {
        return orchestrator.confirmPositive().map(ResponseEntity::ok);
    }

    /** A rejected upload is still a 200: the result body carries the failure reason. */
    @PostMapping("/upload")
    public Mono<ResponseEntity<UploadResult>> upload(@RequestBody UploadRequest request) {
        return orchestrator.uploadTeks(request.token(), request.province()).map(ResponseEntity::ok);
    }

    @PostMapping("/dummy-upload")
    public Mono<ResponseEntity<Map<String, Boolean>>> dummyUpload() {
        return orchestrator.dummyUpload()
            .map(accepted -> ResponseEntity.ok(Map.of("accepted", accepted)));
    }

    @GetMapping("/summaries/exists")
    public Mono<ResponseEntity<Map<String, Boolean>>> hasSummaries() {
        return orchestrator.hasSummaries()
            .map(exists -> ResponseEntity.ok(Map.of("exists", exists)));
    }

    @GetMapping("/countries")
    public Mono<ResponseEntity<List<String>>> countries() {
        return orchestrator.countriesOfInterest().map(ResponseEntity::ok);
    }

    @PutMapping("/countries")
    public Mono<ResponseEntity<List<String>>> updateCountries(@RequestBody CountriesOfInterestRequest request) {
        return orchestrator.updateCountriesOfInterest(request.countries()).map(ResponseEntity::ok);
    }

    @GetMapping("/last-check")
    public Mono<ResponseEntity<Map<String, Instant>>> lastCheck() {
        return orchestrator.lastSuccessfulCheckDate()
            .map(date -> ResponseEntity.ok(Map.of("lastSuccessfulCheckDate", date)))
            .defaultIfEmpty(ResponseEntity.noContent().build());
    }

    @GetMapping("/last-processed-chunk")
    public Mono<ResponseEntity<Map<String, Integer>>> lastProcessedChunk() {
        return orchestrator.lastProcessedChunk()
            .map(chunk -> ResponseEntity.ok(Map.of("chunk", chunk)))
            .defaultIfEmpty(ResponseEntity.noContent().build());
    }

    @PutMapping("/last-processed-chunk")
    public Mono<ResponseEntity<Map<String, Integer>>> updateLastProcessedChunk(
            @RequestBody ProcessedChunkRequest request) {
        return orchestrator.updateLastProcessedChunk(request.chunk())
            .map(chunk -> ResponseEntity.ok(Map.of("chunk", chunk)));
    }

    @PostMapping("/debug/cleanup")
    public Mono<ResponseEntity<Void>> debugCleanup() {
        return orchestrator.debugCleanup()
            .then(Mono.just(ResponseEntity.status(HttpStatus.NO_CONTENT).<Void>build()));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
