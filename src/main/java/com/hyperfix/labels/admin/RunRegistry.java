package com.hyperfix.labels.admin;

import com.hyperfix.labels.config.AppProperties;
import com.hyperfix.labels.model.LabelRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory registry of background batch runs. Nothing survives a restart.
 *
 * <p>Once more than {@code maxRetained} runs are registered, the least recently updated
 * finished runs are evicted. Running runs are never evicted.
 */
@Component
public class RunRegistry {
    private static final Logger log = LoggerFactory.getLogger(RunRegistry.class);

    public static class RunInfo {
        public String runId;
        public volatile String status; // running|completed|failed|cancelled
        public volatile int processed;
        public int total;
        public Instant startedAt;
        public volatile Instant updatedAt;
        public volatile Instant endedAt;
        public volatile String message;
        public volatile List<LabelRecord> records;
    }

    private final Map<String, RunInfo> runs = new ConcurrentHashMap<>();
    private final int maxRetained;

    @Autowired
    public RunRegistry(AppProperties props) {
        this(props.getRuns().getMaxRetained());
    }

    public RunRegistry(int maxRetained) {
        this.maxRetained = maxRetained;
    }

    public void put(RunInfo info) {
        if (info != null && info.runId != null) {
            info.updatedAt = Instant.now();
            RunInfo previous = runs.put(info.runId, info);
            if (previous == null) {
                evictFinished();
            }
        }
    }

    public RunInfo get(String runId) {
        return runId == null ? null : runs.get(runId);
    }

    public int size() {
        return runs.size();
    }

    private void evictFinished() {
        int excess = runs.size() - maxRetained;
        if (maxRetained <= 0 || excess <= 0) return;
        List<String> evicted = runs.values().stream()
                .filter(r -> !"running".equals(r.status))
                .sorted(Comparator.comparing((RunInfo r) -> r.updatedAt))
                .limit(excess)
                .map(r -> r.runId)
                .collect(Collectors.toList());
        evicted.forEach(runs::remove);
        if (!evicted.isEmpty()) {
            log.debug("Evicted {} finished runs", evicted.size());
        }
    }
}
