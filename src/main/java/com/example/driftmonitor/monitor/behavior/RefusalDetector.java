package com.example.driftmonitor.monitor.behavior;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Phrase heuristics for responses that decline to answer.
 */
public final class RefusalDetector {

    static final List<String> PATTERNS = List.of(
            "i apologize, but i cannot",
            "i'm sorry, but i cannot",
            "that's not something i can",
            "i don't feel comfortable",
            "i'm unable to",
            "i am unable to",
            "i'm not able to",
            "i am not able to",
            "i don't have",
            "i do not have",
            "i cannot",
            "i can't",
            "as an ai"
    );

    private RefusalDetector() {
    }

    public static List<String> patterns() {
        return PATTERNS;
    }

    public static boolean isRefusal(String response) {
        return matchedPattern(response).isPresent();
    }

    /**
     * The first (most specific) refusal phrase contained in {@code response}.
     */
    public static Optional<String> matchedPattern(String response) {
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }
        String lower = response.toLowerCase(Locale.ROOT).replace('’', '\'');
        return PATTERNS.stream().filter(lower::contains).findFirst();
    }
}
