package com.hyperfix.labels.util;

import java.util.regex.Pattern;

/**
 * Small string helpers shared by the label pipeline.
 *
 * <p>Whole-word matching here means the literal is bounded by a non-alphanumeric
 * character or by the edge of the text. This is stricter than relying on {@code \b},
 * which behaves differently when the literal itself starts or ends with punctuation.
 */
public final class TextUtils {
    private TextUtils() {}

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String NOT_ALNUM_BEFORE = "(?<![A-Za-z0-9])";
    private static final String NOT_ALNUM_AFTER = "(?![A-Za-z0-9])";

    /**
     * Collapses runs of whitespace to a single space and trims both ends.
     * Returns an empty string for {@code null}.
     */
    public static String collapseWhitespace(String input) {
        if (input == null) return "";
        return WHITESPACE.matcher(input).replaceAll(" ").trim();
    }

    /**
     * Builds a case-insensitive whole-word pattern for the given literal.
     */
    public static Pattern wholeWordPattern(String literal) {
        return Pattern.compile(NOT_ALNUM_BEFORE + Pattern.quote(literal) + NOT_ALNUM_AFTER,
                Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns true when {@code literal} occurs in {@code text} as a whole word, ignoring case.
     */
    public static boolean containsWholeWord(String text, String literal) {
        if (text == null || literal == null || literal.isEmpty()) return false;
        return wholeWordPattern(literal).matcher(text).find();
    }

    /**
     * Deletes every case-insensitive whole-word occurrence of {@code literal} from {@code text}.
     *
     * <p>Regex metacharacters in the literal are matched verbatim. Surrounding whitespace is
     * left alone; callers collapse it afterwards.
     */
    public static String removeWholeWord(String text, String literal) {
        if (text == null) return "";
        if (literal == null || literal.isEmpty()) return text;
        return wholeWordPattern(literal).matcher(text).replaceAll("");
    }

    /**
     * Swaps the decimal separator of a quantity token from comma to period ("1,5L" to "1.5L").
     */
    public static String commaToPeriod(String token) {
        if (token == null) return null;
        return token.replace(',', '.');
    }
}
