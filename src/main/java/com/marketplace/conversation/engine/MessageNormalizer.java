package com.marketplace.conversation.engine;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Folds raw message text into the form every keyword rule is written against:
 * trimmed, lower case, accents removed, runs of whitespace collapsed.
 */
public final class MessageNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private MessageNormalizer() {}

    public static String normalize(String raw) {
        if (raw == null) return "";
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) return "";

        String decomposed = Normalizer.normalize(trimmed, Normalizer.Form.NFD);
        String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        return WHITESPACE.matcher(stripped.toLowerCase(Locale.ROOT)).replaceAll(" ");
    }
}
