package com.hyperfix.labels.service.normalization;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Quantity family backed by a single regular expression.
 *
 * <p>Each match is turned into a token by the supplied formatter, which lets a family keep the
 * whole match, rebuild it from groups, or rewrite its decimal separator.
 */
public class RegexQuantityMatcher implements QuantityMatcher {
    private final String name;
    private final Pattern pattern;
    private final Function<MatchResult, String> formatter;

    public RegexQuantityMatcher(String name, Pattern pattern, Function<MatchResult, String> formatter) {
        this.name = name;
        this.pattern = pattern;
        this.formatter = formatter;
    }

    public RegexQuantityMatcher(String name, Pattern pattern) {
        this(name, pattern, MatchResult::group);
    }

    @Override
    public List<String> match(String upperText, List<String> recorded) {
        List<String> tokens = new ArrayList<>();
        if (upperText == null || upperText.isEmpty()) return tokens;
        Matcher m = pattern.matcher(upperText);
        while (m.find()) {
            String token = formatter.apply(m.toMatchResult());
            if (token != null && !token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    @Override
    public String getName() {
        return name;
    }
}
