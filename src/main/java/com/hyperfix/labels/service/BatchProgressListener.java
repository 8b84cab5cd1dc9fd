package com.hyperfix.labels.service;

import com.hyperfix.labels.model.LabelRecord;

import java.util.List;

/**
 * Receives batch progress. Called twice per record: when it is picked up and when it is done.
 */
@FunctionalInterface
public interface BatchProgressListener {
    /**
     * @param records copy of every record of the batch in input order
     * @param index position of the record that just changed
     */
    void onProgress(List<LabelRecord> records, int index);

    /** Shared no-op instance; the runner skips building snapshots for it. */
    BatchProgressListener NOOP = (records, index) -> {};

    static BatchProgressListener noop() {
        return NOOP;
    }
}
