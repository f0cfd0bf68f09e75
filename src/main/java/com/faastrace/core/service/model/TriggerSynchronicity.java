package com.faastrace.core.service.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Whether the caller waited for the triggered invocation.
 */
public enum TriggerSynchronicity {

    SYNC,
    ASYNC,
    UNIDENTIFIED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TriggerSynchronicity fromValue(String value) {
        if (value == null || value.isBlank()) return UNIDENTIFIED;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNIDENTIFIED;
        }
    }
}
