package com.hyperfix.labels.service.normalization;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Every intermediate result of one pipeline run over a single label.
 *
 * <p>{@code corrected} is exactly what {@link LabelNormalizer#normalize(String)} returns for
 * {@code original}; the other fields explain how it was obtained.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LabelAnalysis {
    private final String original;
    private final String normalizedText;
    /** null when no catalog brand was found */
    private final String brand;
    private final List<String> quantities;
    private final String productName;
    private final String corrected;
    private final List<Warn> warnings;

    public LabelAnalysis(String original, String normalizedText, String brand, List<String> quantities,
                         String productName, String corrected, List<Warn> warnings) {
        this.original = original;
        this.normalizedText = normalizedText;
        this.brand = brand;
        this.quantities = quantities != null ? List.copyOf(quantities) : List.of();
        this.productName = productName;
        this.corrected = corrected;
        this.warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public String getOriginal() { return original; }
    public String getNormalizedText() { return normalizedText; }
    public String getBrand() { return brand; }
    public List<String> getQuantities() { return quantities; }
    public String getProductName() { return productName; }
    public String getCorrected() { return corrected; }
    public List<Warn> getWarnings() { return warnings; }
}
