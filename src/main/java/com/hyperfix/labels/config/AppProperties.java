package com.hyperfix.labels.config;

import com.hyperfix.labels.service.normalization.BrandCatalog;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "app")
public class AppProperties {
    /**
     * Recognized brands in priority order. The first brand present in a label wins.
     */
    private List<String> brands = new ArrayList<>(BrandCatalog.DEFAULT_BRANDS);
    /**
     * Largest number of labels accepted in one batch request.
     */
    private int maxBatchSize = 5000;
    private Pacing pacing = new Pacing();
    private Runs runs = new Runs();

    public List<String> getBrands() {
        return brands;
    }

    public void setBrands(List<String> brands) {
        this.brands = brands;
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    public void setMaxBatchSize(int maxBatchSize) {
        this.maxBatchSize = maxBatchSize;
    }

    public Pacing getPacing() {
        return pacing;
    }

    public void setPacing(Pacing pacing) {
        this.pacing = pacing;
    }

    public Runs getRuns() {
        return runs;
    }

    public void setRuns(Runs runs) {
        this.runs = runs;
    }

    /**
     * Delay before each record of a background run, so the UI can show the list filling in.
     */
    public static class Pacing {
        private boolean enabled = true;
        private long minDelayMs = 200;
        private long maxDelayMs = 500;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getMinDelayMs() {
            return minDelayMs;
        }

        public void setMinDelayMs(long minDelayMs) {
            this.minDelayMs = minDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    /**
     * How long finished background runs stay reachable.
     */
    public static class Runs {
        /** Finished runs kept in the registry; the oldest are evicted first */
        private int maxRetained = 200;
        /** How long a finished run's SSE stream stays open for late subscribers */
        private long streamRetentionMs = 60_000;

        public int getMaxRetained() {
            return maxRetained;
        }

        public void setMaxRetained(int maxRetained) {
            this.maxRetained = maxRetained;
        }

        public long getStreamRetentionMs() {
            return streamRetentionMs;
        }

        public void setStreamRetentionMs(long streamRetentionMs) {
            this.streamRetentionMs = streamRetentionMs;
        }
    }
}
