package com.hyperfix.labels.controller;

import com.hyperfix.labels.admin.ProgressSseService;
import com.hyperfix.labels.admin.RunRegistry;
import com.hyperfix.labels.config.AppProperties;
import com.hyperfix.labels.dto.LabelDtos;
import com.hyperfix.labels.model.BatchProgress;
import com.hyperfix.labels.model.LabelRecord;
import com.hyperfix.labels.service.BatchRunner;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Background batch runs: start a run, poll it, follow it over SSE, or abandon it.
 */
@RestController
@RequestMapping("/batch/runs")
public class BatchController {
    private static final Logger log = LoggerFactory.getLogger(BatchController.class);

    private final BatchRunner batchRunner;
    private final RunRegistry runRegistry;
    private final ProgressSseService progressSseService;
    private final AppProperties appProperties;
    private final Map<String, Disposable> activeRuns = new ConcurrentHashMap<>();

    public BatchController(BatchRunner batchRunner,
                           RunRegistry runRegistry,
                           ProgressSseService progressSseService,
                           AppProperties appProperties) {
        this.batchRunner = batchRunner;
        this.runRegistry = runRegistry;
        this.progressSseService = progressSseService;
        this.appProperties = appProperties;
    }

    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Map<String, Object>>> start(@Valid @RequestBody LabelDtos.BatchRequest body) {
        List<String> labels = body.getLabels() != null ? body.getLabels() : List.of();
        int max = appProperties.getMaxBatchSize();
        if (max > 0 && labels.size() > max) {
            return Mono.just(ResponseEntity.badRequest().body(Map.of(
                    "error", "bad_request",
                    "reason", "Batch of " + labels.size() + " labels exceeds the limit of " + max)));
        }

        String runId = UUID.randomUUID().toString();
        RunRegistry.RunInfo info = new RunRegistry.RunInfo();
        info.runId = runId;
        info.status = "running";
        info.total = labels.size();
        info.startedAt = Instant.now();
        runRegistry.put(info);
        progressSseService.open(runId);
        log.info("Run {} started with {} labels", runId, labels.size());

        // Registered before subscribing: an unpaced run can finish inside subscribe()
        Disposable.Swap slot = Disposables.swap();
        activeRuns.put(runId, slot);
        slot.update(batchRunner.processBatch(labels, (records, index) -> {
                    boolean done = !records.get(index).isProcessing();
                    info.records = records;
                    info.processed = done ? index + 1 : index;
                    runRegistry.put(info);
                    progressSseService.publish(runId, new BatchProgress(runId, index, labels.size(), records));
                })
                .doOnCancel(() -> {
                    info.status = "cancelled";
                    info.endedAt = Instant.now();
                    runRegistry.put(info);
                    progressSseService.complete(runId);
                    log.info("Run {} cancelled after {} of {} labels", runId, info.processed, info.total);
                })
                .doFinally(signal -> activeRuns.remove(runId))
                .subscribe(records -> {
                    info.status = "completed";
                    info.endedAt = Instant.now();
                    info.records = records;
                    info.processed = records.size();
                    runRegistry.put(info);
                    progressSseService.complete(runId);
                    log.info("Run {} completed: {} labels", runId, records.size());
                }, e -> {
                    info.status = "failed";
                    info.endedAt = Instant.now();
                    info.message = e.toString();
                    runRegistry.put(info);
                    progressSseService.fail(runId, e);
                    log.error("Run {} failed: {}", runId, e.toString(), e);
                }));
        return Mono.just(ResponseEntity.ok(Map.of("runId", runId, "status", info.status, "total", info.total)));
    }

    @GetMapping(path = "/{runId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<RunRegistry.RunInfo>> get(@PathVariable String runId) {
        RunRegistry.RunInfo info = runRegistry.get(runId);
        return Mono.just(info != null ? ResponseEntity.ok(info) : ResponseEntity.notFound().build());
    }

    @GetMapping(path = "/{runId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<BatchProgress>> events(@PathVariable String runId) {
        RunRegistry.RunInfo info = runRegistry.get(runId);
        if (info == null) {
            return Flux.error(new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown run " + runId));
        }
        if (!progressSseService.isOpen(runId)) {
            // stream already released; the registry still holds the final state
            return Flux.just(ProgressSseService.toEvent(finalProgress(info)));
        }
        return progressSseService.stream(runId);
    }

    @PostMapping(path = "/{runId}/cancel", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Map<String, Object>>> cancel(@PathVariable String runId) {
        RunRegistry.RunInfo info = runRegistry.get(runId);
        if (info == null) {
            return Mono.just(ResponseEntity.notFound().build());
        }
        Disposable run = activeRuns.remove(runId);
        if (run != null) {
            run.dispose();
        }
        return Mono.just(ResponseEntity.ok(Map.of("runId", runId, "status", info.status)));
    }

    private static BatchProgress finalProgress(RunRegistry.RunInfo info) {
        List<LabelRecord> records = info.records != null ? info.records : List.of();
        return new BatchProgress(info.runId, Math.max(records.size() - 1, 0), info.total, records);
    }
}
