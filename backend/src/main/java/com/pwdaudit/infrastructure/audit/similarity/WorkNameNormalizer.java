package com.pwdaudit.infrastructure.audit.similarity;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Normalizes work names before they are compared:
 * - Unicode NFKD decomposition, then combining marks dropped (diacritics, Devanagari matras)
 * - Invisible character removal
 * - Case folding
 * - Digits (any script) and punctuation replaced by spaces, so chainage figures do not count
 * - Filler words dropped, whitespace collapsed
 */
@Component
public class WorkNameNormalizer {

    // Zero-width and invisible Unicode characters
    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\u2060\\u180E]"
    );

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    // Anything that is not a letter: digits of every script, punctuation, danda, symbols
    private static final Pattern NON_LETTERS = Pattern.compile("[^\\p{L}]+");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // Words that only frame the chainage ("km 10 to 12", "ch 3/500")
    private static final Set<String> FILLER_WORDS = Set.of(
            "km", "ch", "to", "from", "of", "the", "and", "in", "on", "at", "section", "part"
    );

    /**
     * Normalize a work name.
     *
     * @param text work name as written in the register
     * @return comparison key, empty for null or blank input
     */
    public String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }

        // 1. Compatibility decomposition
        String result = Normalizer.normalize(text, Normalizer.Form.NFKD);

        // 2. Drop combining marks and invisible characters
        result = COMBINING_MARKS.matcher(result).replaceAll("");
        result = INVISIBLE_CHARS.matcher(result).replaceAll("");

        // 3. Case fold
        result = result.toLowerCase(Locale.ROOT);

        // 4. Only letters survive
        result = NON_LETTERS.matcher(result).replaceAll(" ");

        // 5. Filler words out, single spaces
        return Arrays.stream(WHITESPACE.split(result.strip()))
                .filter(word -> !word.isEmpty() && !FILLER_WORDS.contains(word))
                .collect(Collectors.joining(" "));
    }
}
