package com.faastrace.core.service.correlation;

import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Turns the identifying attributes of a trigger into a canonical string.
 *
 * Two triggers describing the same cloud event yield the same string regardless of
 * attribute insertion order: entries are stringified, sorted by name in code point
 * order and joined as {@code name#value} pairs separated by {@code ##}.
 */
public final class IdentifierNormalizer {

    private static final String PAIR_DELIMITER = "#";
    private static final String ENTRY_DELIMITER = "##";

    private IdentifierNormalizer() {
    }

    public static String canonicalize(Map<String, ?> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return "";
        }
        return attributes.entrySet().stream()
                .map(entry -> Map.entry(stringify(entry.getKey()), stringify(entry.getValue())))
                .sorted(Map.Entry.<String, String>comparingByKey())
                .map(entry -> entry.getKey() + PAIR_DELIMITER + entry.getValue())
                .collect(Collectors.joining(ENTRY_DELIMITER));
    }

    private static String stringify(Object value) {
        return Objects.toString(value, "");
    }
}
