package com.hyperfix.labels.service;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Delay inserted before each record of a batch is corrected, so an interactive client can
 * watch the list fill in. It has no effect on the corrected labels.
 */
@FunctionalInterface
public interface PacingPolicy {
    Duration nextDelay();

    /** No delay; used headless and in tests. */
    static PacingPolicy none() {
        return () -> Duration.ZERO;
    }

    /** Uniformly random delay in {@code [minMs, maxMs]}. */
    static PacingPolicy randomBetween(long minMs, long maxMs) {
        long lo = Math.max(0, Math.min(minMs, maxMs));
        long hi = Math.max(0, Math.max(minMs, maxMs));
        return () -> Duration.ofMillis(lo == hi ? lo : ThreadLocalRandom.current().nextLong(lo, hi + 1));
    }
}
