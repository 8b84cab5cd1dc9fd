package com.hyperfix.labels.dto;

import com.hyperfix.labels.model.LabelRecord;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public class LabelDtos {
    public static class NormalizeRequest {
        @NotNull
        private String label;

        public NormalizeRequest() {}
        public NormalizeRequest(String label) { this.label = label; }

        public String getLabel() { return label; }
        public void setLabel(String label) { this.label = label; }
    }

    public static class NormalizeResponse {
        private String original;
        private String corrected;

        public NormalizeResponse() {}
        public NormalizeResponse(String original, String corrected) {
            this.original = original;
            this.corrected = corrected;
        }

        public String getOriginal() { return original; }
        public void setOriginal(String original) { this.original = original; }
        public String getCorrected() { return corrected; }
        public void setCorrected(String corrected) { this.corrected = corrected; }
    }

    public static class BatchRequest {
        @NotNull
        private List<String> labels;

        public BatchRequest() {}
        public BatchRequest(List<String> labels) { this.labels = labels; }

        public List<String> getLabels() { return labels; }
        public void setLabels(List<String> labels) { this.labels = labels; }
    }

    /** Summary of a finished batch */
    public static class BatchReport {
        private int total;
        private int with_brand; // labels where a catalog brand was recognized
        private int with_quantity; // labels where at least one quantity was recognized
        private List<LabelRecord> records;

        public int getTotal() { return total; }
        public void setTotal(int total) { this.total = total; }
        public int getWith_brand() { return with_brand; }
        public void setWith_brand(int with_brand) { this.with_brand = with_brand; }
        public int getWith_quantity() { return with_quantity; }
        public void setWith_quantity(int with_quantity) { this.with_quantity = with_quantity; }
        public List<LabelRecord> getRecords() { return records; }
        public void setRecords(List<LabelRecord> records) { this.records = records; }
    }

    public static class ImportResponse {
        private List<String> labels;
        private int count;

        public ImportResponse() {}
        public ImportResponse(List<String> labels) {
            this.labels = labels;
            this.count = labels != null ? labels.size() : 0;
        }

        public List<String> getLabels() { return labels; }
        public void setLabels(List<String> labels) { this.labels = labels; }
        public int getCount() { return count; }
        public void setCount(int count) { this.count = count; }
    }
}
