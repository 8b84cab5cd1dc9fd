package com.hyperfix.labels.admin;

import com.hyperfix.labels.config.AppProperties;
import com.hyperfix.labels.model.BatchProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fans out batch progress to SSE clients. Each run gets one sink that replays only the latest
 * snapshot; every snapshot already carries the state of all records, so a client that connects
 * late loses nothing. A sink is released {@code retention} after its run ends.
 */
@Service
public class ProgressSseService {
    private static final Logger log = LoggerFactory.getLogger(ProgressSseService.class);
    private static final Duration HEARTBEAT = Duration.ofSeconds(10);

    private final Map<String, Sinks.Many<BatchProgress>> runIdToSink = new ConcurrentHashMap<>();
    private final Duration retention;

    @Autowired
    public ProgressSseService(AppProperties props) {
        this(Duration.ofMillis(props.getRuns().getStreamRetentionMs()));
    }

    public ProgressSseService(Duration retention) {
        this.retention = retention != null ? retention : Duration.ZERO;
    }

    /** Creates the run's sink; must be called before the run publishes anything. */
    public void open(String runId) {
        if (runId == null) return;
        runIdToSink.computeIfAbsent(runId, k -> Sinks.many().replay().latest());
    }

    public boolean isOpen(String runId) {
        return runId != null && runIdToSink.containsKey(runId);
    }

    public void publish(String runId, BatchProgress progress) {
        Sinks.Many<BatchProgress> sink = sink(runId);
        if (sink != null) {
            sink.tryEmitNext(progress);
        }
    }

    public void complete(String runId) {
        Sinks.Many<BatchProgress> sink = sink(runId);
        if (sink != null) {
            sink.tryEmitComplete();
            release(runId, sink);
        }
    }

    public void fail(String runId, Throwable error) {
        Sinks.Many<BatchProgress> sink = sink(runId);
        if (sink != null) {
            sink.tryEmitError(error);
            release(runId, sink);
        }
    }

    /** Progress events of the run, or an empty stream once its sink has been released. */
    public Flux<ServerSentEvent<BatchProgress>> stream(String runId) {
        Sinks.Many<BatchProgress> sink = sink(runId);
        if (sink == null) {
            return Flux.empty();
        }
        Flux<BatchProgress> progress = sink.asFlux();
        Flux<ServerSentEvent<BatchProgress>> events = progress.map(ProgressSseService::toEvent);
        Flux<ServerSentEvent<BatchProgress>> heartbeat = Flux.interval(HEARTBEAT)
                .map(i -> ServerSentEvent.<BatchProgress>builder().comment("keepalive").build())
                .takeUntilOther(progress.ignoreElements().onErrorResume(e -> Mono.empty()));
        return Flux.merge(events, heartbeat)
                .doOnCancel(() -> log.debug("SSE client disconnected for runId={}", runId));
    }

    public static ServerSentEvent<BatchProgress> toEvent(BatchProgress p) {
        boolean started = p.current() != null && p.current().isProcessing();
        return ServerSentEvent.builder(p)
                .event("progress")
                .id(p.getIndex() + "-" + (started ? "start" : "done"))
                .build();
    }

    private Sinks.Many<BatchProgress> sink(String runId) {
        return runId == null ? null : runIdToSink.get(runId);
    }

    private void release(String runId, Sinks.Many<BatchProgress> sink) {
        if (retention.isZero() || retention.isNegative()) {
            runIdToSink.remove(runId, sink);
            return;
        }
        Mono.delay(retention).subscribe(t -> {
            runIdToSink.remove(runId, sink);
            log.debug("Released SSE stream for runId={}", runId);
        });
    }
}
