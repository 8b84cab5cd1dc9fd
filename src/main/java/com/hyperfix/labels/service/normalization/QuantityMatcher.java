package com.hyperfix.labels.service.normalization;

import java.util.List;

/**
 * One family of the quantity cascade.
 *
 * <p>Every matcher scans the same uppercased, normalized label text. Matchers do not consume
 * the spans they recognize, so two families may report the same physical substring in
 * different textual forms; the {@link QuantityExtractor} only removes literal repeats.
 *
 * <h3>Implementation Guidelines</h3>
 * <ul>
 *   <li>Matchers should be <strong>pure</strong>: same text and recorded tokens, same result</li>
 *   <li>Returned tokens are already canonical (comma as decimal separator)</li>
 *   <li>Tokens are returned in the order they occur in the text</li>
 * </ul>
 *
 * @see QuantityPatterns
 * @see QuantityExtractor
 */
public interface QuantityMatcher {
    /**
     * Finds candidate quantity tokens in the given text.
     *
     * @param upperText normalized label text, already uppercased
     * @param recorded tokens produced by earlier families of the cascade, in discovery order
     * @return candidate tokens in text order, possibly empty, never null
     */
    List<String> match(String upperText, List<String> recorded);

    /**
     * Gets the name of this family for logging and debugging.
     */
    default String getName() {
        return this.getClass().getSimpleName();
    }
}
