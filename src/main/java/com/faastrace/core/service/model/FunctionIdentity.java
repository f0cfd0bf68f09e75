package com.faastrace.core.service.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Identity of a deployed function, used as the grouping key for profiles.
 */
public record FunctionIdentity(
        Provider provider,
        String functionName,
        String handler
) {

    private static final String KEY_DELIMITER = "::";

    /**
     * Canonical key, e.g. {@code aws::thumbnailer::handler.main}.
     */
    @JsonIgnore
    public String key() {
        var resolvedProvider = provider != null ? provider : Provider.UNIDENTIFIED;
        return resolvedProvider.value()
                + KEY_DELIMITER + nullToEmpty(functionName)
                + KEY_DELIMITER + nullToEmpty(handler);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
