package com.hyperfix.labels.service.normalization;

import com.hyperfix.labels.util.TextUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rebuilds a label as {@code BRAND PRODUCT QUANTITIES}.
 *
 * <p>The product name is whatever remains of the normalized text once the brand and every
 * quantity token are deleted. Quantities are deleted in both decimal spellings ("1,5L" and
 * "1.5L") because the source text may still carry the period form. A compact token such as
 * "5KG" is also deleted in its spaced form "5 KG", which is how the small-quantity family
 * finds it. All spellings of all tokens are deleted longest first, so a short token such as
 * "10L" cannot cut into a longer one such as "1/10L" and leave "1/" behind. Extraction order
 * only governs the order of the appended quantities.
 *
 * <p>A run of periods that closes a word ("nat." or "nat...") is dropped from the product
 * name. Periods next to digits are left alone.
 */
public class LabelAssembler {
    private static final Pattern WORD_END_PERIOD = Pattern.compile("(?<=[A-Za-z])\\.+(?![A-Za-z0-9.])");
    private static final Pattern COMPACT_UNIT = Pattern.compile("^(.*\\d)(KG|G|L|ML|CL)$", Pattern.CASE_INSENSITIVE);

    public String productName(String normalizedText, String brand, List<String> quantities) {
        String working = normalizedText != null ? normalizedText : "";
        if (brand != null && !brand.isEmpty()) {
            working = TextUtils.removeWholeWord(working, brand);
        }
        if (quantities != null) {
            Set<String> spellings = new LinkedHashSet<>();
            for (String quantity : quantities) {
                spellings.addAll(spellings(quantity));
            }
            List<String> longestFirst = new ArrayList<>(spellings);
            longestFirst.sort(Comparator.comparingInt((String s) -> s.length()).reversed());
            for (String spelling : longestFirst) {
                working = TextUtils.removeWholeWord(working, spelling);
            }
        }
        working = WORD_END_PERIOD.matcher(working).replaceAll("");
        return TextUtils.collapseWhitespace(working);
    }

    private static List<String> spellings(String quantity) {
        List<String> out = new ArrayList<>();
        out.add(quantity);
        out.add(TextUtils.commaToPeriod(quantity));
        Matcher m = COMPACT_UNIT.matcher(quantity);
        if (m.matches()) {
            String spaced = m.group(1) + " " + m.group(2);
            out.add(spaced);
            out.add(TextUtils.commaToPeriod(spaced));
        }
        return out;
    }

    public String assemble(String brand, String productName, List<String> quantities) {
        List<String> parts = new ArrayList<>();
        if (brand != null && !brand.isEmpty()) parts.add(brand);
        if (productName != null && !productName.isEmpty()) parts.add(productName);
        if (quantities != null) parts.addAll(quantities);
        return TextUtils.collapseWhitespace(String.join(" ", parts).toUpperCase(Locale.ROOT));
    }
}
