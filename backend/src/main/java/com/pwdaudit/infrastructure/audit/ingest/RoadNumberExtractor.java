package com.pwdaudit.infrastructure.audit.ingest;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a road number such as "SH-123", "MDR 45" or "NH4A" out of free text and
 * returns it in compact form ("SH123", "MDR45", "NH4A").
 */
@Component
public class RoadNumberExtractor {

    // Longer prefixes first so "MDR" is not read as a bare "DR"
    private static final Pattern ROAD_NUMBER = Pattern.compile(
            "(?<![A-Z])(MDR|ODR|SH|NH|VR)\\s*[-.]?\\s*(?:NO\\.?\\s*)?(\\d{1,4}[A-Z]?)(?![0-9])",
            Pattern.CASE_INSENSITIVE
    );

    public Optional<String> extract(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = ROAD_NUMBER.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of((matcher.group(1) + matcher.group(2)).toUpperCase(Locale.ROOT));
    }

    /**
     * Normalize a road number given in its own column. Falls back to the trimmed,
     * upper-cased value when it does not look like a classified road.
     */
    public String normalize(String roadNumber) {
        return extract(roadNumber)
                .orElseGet(() -> roadNumber.strip().toUpperCase(Locale.ROOT).replaceAll("[\\s-]", ""));
    }
}
