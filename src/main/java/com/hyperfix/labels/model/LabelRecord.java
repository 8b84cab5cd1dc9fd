package com.hyperfix.labels.model;

/**
 * One line of a batch: the label as submitted and its correction.
 *
 * <p>Records are owned by the batch that created them and updated in place while the batch
 * runs. Anything handed to listeners or callers outside the batch is a {@link #copy()}.
 */
public class LabelRecord {
    private String original;
    private String corrected;
    private boolean processing;

    /**
     * Default constructor for JSON deserialization.
     */
    public LabelRecord() {}

    public LabelRecord(String original, String corrected, boolean processing) {
        this.original = original;
        this.corrected = corrected;
        this.processing = processing;
    }

    /** A record not yet picked up by its batch. */
    public static LabelRecord pending(String original) {
        return new LabelRecord(original, "", false);
    }

    public LabelRecord copy() {
        return new LabelRecord(original, corrected, processing);
    }

    public String getOriginal() { return original; }
    public void setOriginal(String original) { this.original = original; }
    public String getCorrected() { return corrected; }
    public void setCorrected(String corrected) { this.corrected = corrected; }
    public boolean isProcessing() { return processing; }
    public void setProcessing(boolean processing) { this.processing = processing; }

    @Override
    public String toString() {
        return "LabelRecord{original='" + original + "', corrected='" + corrected + "', processing=" + processing + "}";
    }
}
