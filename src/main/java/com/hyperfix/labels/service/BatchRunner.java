package com.hyperfix.labels.service;

import com.hyperfix.labels.model.BatchProgress;
import com.hyperfix.labels.model.LabelRecord;
import com.hyperfix.labels.service.normalization.LabelNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs the label pipeline over a list of labels, one record at a time, in input order.
 *
 * <p>For every record the listener sees two notifications: one when the record is marked in
 * flight and one once its correction is written. The only suspension point is the pacing delay
 * between the two. Cancelling the returned publisher abandons the rest of the batch; records
 * already completed keep their correction.
 */
@Service
public class BatchRunner {
    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    private final LabelNormalizer normalizer;
    private final PacingPolicy pacing;

    public BatchRunner(LabelNormalizer normalizer, PacingPolicy pacing) {
        this.normalizer = normalizer;
        this.pacing = pacing != null ? pacing : PacingPolicy.none();
    }

    /**
     * Corrects every label and completes with the finished records.
     *
     * @param labels labels in input order
     * @param onProgress called with a copy of all records after each state change
     */
    public Mono<List<LabelRecord>> processBatch(List<String> labels, BatchProgressListener onProgress) {
        BatchProgressListener listener = onProgress != null ? onProgress : BatchProgressListener.noop();
        return Mono.defer(() -> {
            List<LabelRecord> records = labels == null ? new ArrayList<>() : labels.stream()
                    .map(LabelRecord::pending)
                    .collect(Collectors.toCollection(ArrayList::new));
            log.info("Batch started: {} labels", records.size());
            long started = System.currentTimeMillis();

            return Flux.range(0, records.size())
                    .concatMap(i -> processOne(records, i, listener))
                    .then(Mono.fromCallable(() -> {
                        log.info("Batch completed: {} labels in {} ms", records.size(), System.currentTimeMillis() - started);
                        return snapshot(records);
                    }))
                    .doOnCancel(() -> log.info("Batch of {} labels abandoned", records.size()));
        });
    }

    /**
     * Same batch as {@link #processBatch}, exposed as a stream of progress snapshots.
     * The stream completes after the last record; cancelling it cancels the batch.
     */
    public Flux<BatchProgress> streamBatch(String runId, List<String> labels) {
        int total = labels == null ? 0 : labels.size();
        return Flux.create(sink -> {
            Disposable batch = processBatch(labels,
                    (records, index) -> sink.next(new BatchProgress(runId, index, total, records)))
                    .subscribe(done -> {}, sink::error, sink::complete);
            sink.onDispose(batch);
        });
    }

    private Mono<LabelRecord> processOne(List<LabelRecord> records, int index, BatchProgressListener listener) {
        LabelRecord record = records.get(index);
        record.setProcessing(true);
        emit(listener, records, index);

        return delay().then(Mono.fromCallable(() -> {
            record.setCorrected(normalizer.normalize(record.getOriginal()));
            record.setProcessing(false);
            emit(listener, records, index);
            return record;
        }));
    }

    private static void emit(BatchProgressListener listener, List<LabelRecord> records, int index) {
        if (listener == BatchProgressListener.NOOP) return;
        listener.onProgress(snapshot(records), index);
    }

    private Mono<Void> delay() {
        Duration d = pacing.nextDelay();
        if (d == null || d.isZero() || d.isNegative()) {
            return Mono.empty();
        }
        return Mono.delay(d).then();
    }

    private static List<LabelRecord> snapshot(List<LabelRecord> records) {
        List<LabelRecord> copy = new ArrayList<>(records.size());
        for (LabelRecord r : records) copy.add(r.copy());
        return copy;
    }
}
