package com.marketplace.conversation.engine;

import com.marketplace.conversation.model.Intent;

import java.util.function.Predicate;

/**
 * One tagged predicate in the classifier's priority list.
 */
public record IntentRule(Intent intent, String name, Predicate<String> predicate) {

    public static IntentRule of(Intent intent, TextPattern pattern) {
        return new IntentRule(intent, pattern.getName(), pattern::matches);
    }

    public boolean matches(String normalizedText) {
        return predicate.test(normalizedText);
    }
}
