package com.marketplace.conversation.engine;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A compiled set of phrases or regular expressions matched against normalized text.
 * Phrases only match on word boundaries, so "pago" does not fire inside "apagon".
 */
public final class TextPattern {

    private final String name;
    private final List<String> sources;
    private final Pattern pattern;

    private TextPattern(String name, List<String> sources, Pattern pattern) {
        this.name = name;
        this.sources = sources;
        this.pattern = pattern;
    }

    public static TextPattern phrases(String name, String... phrases) {
        String alternation = Arrays.stream(phrases)
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        Pattern compiled = Pattern.compile("(?<![\\p{L}\\p{N}])(?:" + alternation + ")(?![\\p{L}\\p{N}])");
        return new TextPattern(name, List.of(phrases), compiled);
    }

    public static TextPattern regex(String name, String... expressions) {
        String alternation = Arrays.stream(expressions)
                .map(e -> "(?:" + e + ")")
                .collect(Collectors.joining("|"));
        return new TextPattern(name, List.of(expressions), Pattern.compile(alternation));
    }

    public boolean matches(String normalizedText) {
        if (normalizedText == null || normalizedText.isEmpty()) return false;
        return pattern.matcher(normalizedText).find();
    }

    public String getName() {
        return name;
    }

    public List<String> getSources() {
        return sources;
    }

    @Override
    public String toString() {
        return name;
    }
}
