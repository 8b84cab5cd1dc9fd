package com.hyperfix.labels.service.normalization;

import java.util.List;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * The quantity cascade, in evaluation order.
 *
 * <p>Units recognized everywhere: KG, G, L, ML, CL. All patterns run against uppercased text.
 */
public final class QuantityPatterns {
    private QuantityPatterns() {}

    private static final String UNIT = "(?:KG|G|L|ML|CL)";
    private static final Pattern PERIOD_DECIMAL = Pattern.compile("(\\d+)\\.(\\d+)");

    /** "1.5L", "2,5 ML" */
    public static final QuantityMatcher DECIMAL = new RegexQuantityMatcher("decimal",
            Pattern.compile("\\b\\d+[.,]\\d+\\s*" + UNIT + "\\b"),
            m -> periodToComma(m.group()));

    /** "6X30G", "4X1.5L" */
    public static final QuantityMatcher MULTIPLIER = new RegexQuantityMatcher("multiplier",
            Pattern.compile("\\b\\d+X\\d+[.,]?\\d*\\s*" + UNIT + "\\b"),
            m -> periodToComma(m.group()));

    /** "500G", "75 CL": at least 10, single stray digits are usually counts or model numbers */
    public static final QuantityMatcher LARGE = new RegexQuantityMatcher("large",
            Pattern.compile("\\b(?:[1-9]\\d{2,}|[1-9]\\d)\\s*" + UNIT + "\\b"));

    /** "1L", "2 KG": only at the start of the text or after whitespace; the inner space is dropped */
    public static final QuantityMatcher SMALL = new RegexQuantityMatcher("small",
            Pattern.compile("(?:^|\\s)([1-9])\\s*(KG|G|L|ML|CL)\\b"),
            m -> m.group(1) + m.group(2));

    /** "1/2L" */
    public static final QuantityMatcher FRACTION_WITH_UNIT = new RegexQuantityMatcher("fraction-unit",
            Pattern.compile("\\b\\d+/\\d+\\s*" + UNIT + "\\b"),
            MatchResult::group);

    /** "1/2" */
    public static final QuantityMatcher BARE_FRACTION = new BareFractionMatcher();

    public static List<QuantityMatcher> cascade() {
        return List.of(DECIMAL, MULTIPLIER, LARGE, SMALL, FRACTION_WITH_UNIT, BARE_FRACTION);
    }

    static String periodToComma(String token) {
        return PERIOD_DECIMAL.matcher(token).replaceAll("$1,$2");
    }
}
