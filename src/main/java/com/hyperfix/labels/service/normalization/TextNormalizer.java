package com.hyperfix.labels.service.normalization;

import com.hyperfix.labels.util.TextUtils;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * First stage of the label pipeline: removes accents and symbols the catalog format does not allow.
 *
 * <p>Rules applied in order:
 * <ol>
 *   <li>Unicode canonical decomposition (NFD), so "é" becomes "e" plus a combining accent</li>
 *   <li>Delete combining marks</li>
 *   <li>Replace anything outside letters, digits, whitespace and {@code , . / + -} with a space</li>
 *   <li>Collapse whitespace and trim</li>
 * </ol>
 *
 * <p>Case is preserved. The operation is total: {@code null} and empty input both yield "".
 */
public final class TextNormalizer {
    private TextNormalizer() {}

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern DISALLOWED = Pattern.compile("[^A-Za-z0-9\\s,./+\\-]");

    public static String normalize(String input) {
        if (input == null || input.isEmpty()) return "";
        String decomposed = Normalizer.normalize(input, Normalizer.Form.NFD);
        String withoutMarks = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        String allowedOnly = DISALLOWED.matcher(withoutMarks).replaceAll(" ");
        return TextUtils.collapseWhitespace(allowedOnly);
    }
}
