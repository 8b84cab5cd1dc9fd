package com.hyperfix.labels.service.normalization;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Extracts pack-size and volume tokens from normalized label text.
 *
 * <p>The cascade families run one after another over the same text and their candidates are
 * appended in cascade order. Duplicates are then dropped by exact string equality while the
 * first occurrence keeps its position. Tokens that denote the same amount but read differently
 * ("1/2L" and "1/2" when both survive, "1,50L" and "50L") are intentionally not merged.
 */
public class QuantityExtractor {
    private static final Logger log = LoggerFactory.getLogger(QuantityExtractor.class);

    private final List<QuantityMatcher> cascade;

    public QuantityExtractor() {
        this(QuantityPatterns.cascade());
    }

    public QuantityExtractor(List<QuantityMatcher> cascade) {
        this.cascade = List.copyOf(cascade);
    }

    public List<String> extract(String normalizedText) {
        if (normalizedText == null || normalizedText.isEmpty()) return List.of();
        String upper = normalizedText.toUpperCase(Locale.ROOT);

        List<String> candidates = new ArrayList<>();
        for (QuantityMatcher matcher : cascade) {
            List<String> found = matcher.match(upper, List.copyOf(candidates));
            if (!found.isEmpty()) {
                log.trace("{} matched {} in '{}'", matcher.getName(), found, upper);
            }
            candidates.addAll(found);
        }

        Set<String> distinct = new LinkedHashSet<>(candidates);
        return List.copyOf(distinct);
    }

    public List<QuantityMatcher> getCascade() {
        return cascade;
    }
}
