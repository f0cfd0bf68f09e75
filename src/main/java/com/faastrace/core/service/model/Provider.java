package com.faastrace.core.service.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Cloud provider that hosted an invocation or a trigger.
 */
public enum Provider {

    AWS,
    GCP,
    AZURE,
    LOCAL,
    UNIDENTIFIED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient lookup, unknown or missing values map to {@link #UNIDENTIFIED}.
     */
    @JsonCreator
    public static Provider fromValue(String value) {
        if (value == null || value.isBlank()) return UNIDENTIFIED;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNIDENTIFIED;
        }
    }
}
