package com.pwdaudit.infrastructure.audit.similarity;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Sorensen-Dice coefficient over character bigrams of the normalized names.
 * Works the same for Latin and Devanagari text since it never tokenizes by language.
 */
@Component
@RequiredArgsConstructor
public class BigramNameSimilarity implements NameSimilarity {

    private final WorkNameNormalizer normalizer;

    @Override
    public double score(String a, String b) {
        String left = normalizer.normalize(a).replace(" ", "");
        String right = normalizer.normalize(b).replace(" ", "");
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        if (left.equals(right)) {
            return 1.0;
        }
        if (left.length() < 2 || right.length() < 2) {
            return 0.0;
        }

        Map<String, Integer> leftBigrams = bigrams(left);
        int matches = 0;
        for (int i = 0; i < right.length() - 1; i++) {
            String bigram = right.substring(i, i + 2);
            Integer count = leftBigrams.get(bigram);
            if (count != null && count > 0) {
                leftBigrams.put(bigram, count - 1);
                matches++;
            }
        }
        return (2.0 * matches) / ((left.length() - 1) + (right.length() - 1));
    }

    private static Map<String, Integer> bigrams(String text) {
        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i < text.length() - 1; i++) {
            counts.merge(text.substring(i, i + 2), 1, Integer::sum);
        }
        return counts;
    }
}
