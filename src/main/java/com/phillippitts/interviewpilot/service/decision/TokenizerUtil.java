package com.phillippitts.interviewpilot.service.decision;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Utility for tokenizing answers and rubric points into normalized content words.
 *
 * <p>Tokenization rules:
 * <ul>
 *   <li>Split on anything that is not a letter or digit</li>
 *   <li>Lowercase (root locale)</li>
 *   <li>Drop tokens shorter than two characters and common stop words</li>
 * </ul>
 */
public final class TokenizerUtil {

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "how", "i", "in", "is",
            "it", "its", "of", "on", "or", "that", "the", "this", "to", "was", "we", "what", "when",
            "which", "with", "you", "your", "my", "me", "our", "do", "did", "can");

    private TokenizerUtil() {
        // Prevent instantiation
    }

    /**
     * @param text input text (may be null or blank)
     * @return immutable list of content tokens in order of appearance
     */
    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String[] parts = text.toLowerCase(Locale.ROOT).split("[^\\p{Alnum}]+");
        List<String> tokens = new ArrayList<>();
        for (String part : parts) {
            if (part.length() >= 2 && !STOP_WORDS.contains(part)) {
                tokens.add(part);
            }
        }
        return List.copyOf(tokens);
    }
}
