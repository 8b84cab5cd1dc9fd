package com.hyperfix.labels.service.normalization;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Informational note attached to a label analysis.
 *
 * <p>Warnings never change the corrected label. They point back-office staff at labels worth a
 * second look.
 *
 * <h3>Warning Types</h3>
 * <ul>
 *   <li><strong>MISSING_BRAND</strong> - No catalog brand found in the label</li>
 *   <li><strong>MISSING_QUANTITY</strong> - No pack size or volume recognized</li>
 *   <li><strong>QUANTITY_OVERLAP</strong> - Two kept tokens where one contains the other's text</li>
 * </ul>
 *
 * @see LabelAnalysis
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Warn {
    /** Label as submitted */
    private String label;

    /** Warning code for categorization */
    private String code;

    /** Human-readable warning message */
    private String message;

    /** Supporting evidence, e.g. the overlapping tokens */
    private String evidence;

    /**
     * Default constructor for JSON deserialization.
     */
    public Warn() {}

    public Warn(String label, String code, String message, String evidence) {
        this.label = label;
        this.code = code;
        this.message = message;
        this.evidence = evidence;
    }

    public String getLabel() { return label; }
    public void setLabel(String label) { this.label = label; }
    public String getCode() { return code; }
    public void setCode(String code) { this.code = code; }
    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
    public String getEvidence() { return evidence; }
    public void setEvidence(String evidence) { this.evidence = evidence; }

    public static Warn missingBrand(String label) {
        return new Warn(label, "MISSING_BRAND", "No known brand in label", null);
    }

    public static Warn missingQuantity(String label) {
        return new Warn(label, "MISSING_QUANTITY", "No pack size or volume recognized", null);
    }

    /**
     * Two different cascade families reported the same amount in different spellings.
     *
     * @param label Label as submitted
     * @param shorter Token contained in the other one
     * @param longer Token containing the shorter one
     * @return A quantity overlap warning
     */
    public static Warn quantityOverlap(String label, String shorter, String longer) {
        return new Warn(label, "QUANTITY_OVERLAP",
                String.format("Quantity '%s' overlaps '%s'", shorter, longer), shorter + " | " + longer);
    }

    @Override
    public String toString() {
        return code + ": " + message + (evidence != null ? " (" + evidence + ")" : "");
    }
}
