package com.hyperfix.labels.service.normalization;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last family of the cascade: fractions written without a unit, e.g. "1/2" in "FROMAGE 1/2 SEL".
 *
 * <p>A fraction is skipped when a token recorded earlier already contains it, which is how
 * "1/2L" captured with its unit does not come back a second time as a bare "1/2".
 */
public class BareFractionMatcher implements QuantityMatcher {
    private static final Pattern BARE_FRACTION = Pattern.compile("\\b\\d+/\\d+\\b");

    @Override
    public List<String> match(String upperText, List<String> recorded) {
        List<String> seen = new ArrayList<>(recorded != null ? recorded : List.of());
        List<String> tokens = new ArrayList<>();
        if (upperText == null || upperText.isEmpty()) return tokens;
        Matcher m = BARE_FRACTION.matcher(upperText);
        while (m.find()) {
            String fraction = m.group();
            if (seen.stream().noneMatch(token -> token.contains(fraction))) {
                tokens.add(fraction);
                seen.add(fraction);
            }
        }
        return tokens;
    }

    @Override
    public String getName() {
        return "bare-fraction";
    }
}
