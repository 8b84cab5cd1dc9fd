package com.hyperfix.labels.model;

import java.util.List;

/**
 * Snapshot sent on every progress notification of a streamed batch.
 */
public class BatchProgress {
    private String runId;
    /** Index of the record that just changed */
    private int index;
    private int total;
    private List<LabelRecord> records;

    public BatchProgress() {}

    public BatchProgress(String runId, int index, int total, List<LabelRecord> records) {
        this.runId = runId;
        this.index = index;
        this.total = total;
        this.records = records;
    }

    public String getRunId() { return runId; }
    public void setRunId(String runId) { this.runId = runId; }
    public int getIndex() { return index; }
    public void setIndex(int index) { this.index = index; }
    public int getTotal() { return total; }
    public void setTotal(int total) { this.total = total; }
    public List<LabelRecord> getRecords() { return records; }
    public void setRecords(List<LabelRecord> records) { this.records = records; }

    /** The record at {@link #getIndex()}. */
    public LabelRecord current() {
        return records != null && index >= 0 && index < records.size() ? records.get(index) : null;
    }
}
