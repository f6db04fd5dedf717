package com.embeddingstudio.vectordb.common.query;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lower-case word tokenization shared by the text operators.
 */
public final class TextTokens {

    private static final Pattern SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");

    private TextTokens() {
    }

    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(SEPARATOR.split(text.toLowerCase(Locale.ROOT)))
                .filter(token -> !token.isEmpty())
                .toList();
    }

    public static boolean containsAll(List<String> tokens, List<String> required) {
        return !required.isEmpty() && tokens.containsAll(required);
    }

    /**
     * Whether {@code phrase} occurs in {@code tokens} as a contiguous run.
     */
    public static boolean containsSequence(List<String> tokens, List<String> phrase) {
        if (phrase.isEmpty() || phrase.size() > tokens.size()) {
            return false;
        }
        for (int start = 0; start + phrase.size() <= tokens.size(); start++) {
            if (tokens.subList(start, start + phrase.size()).equals(phrase)) {
                return true;
            }
        }
        return false;
    }
}
