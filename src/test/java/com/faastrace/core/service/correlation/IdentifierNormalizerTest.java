package com.faastrace.core.service.correlation;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class IdentifierNormalizerTest {

    @Test
    void canonicalFormIsIndependentOfAttributeOrder() {
        var first = new LinkedHashMap<String, Object>();
        first.put("queue", "orders");
        first.put("message_id", "m-1");
        var second = new LinkedHashMap<String, Object>();
        second.put("message_id", "m-1");
        second.put("queue", "orders");

        assertThat(IdentifierNormalizer.canonicalize(first))
                .isEqualTo(IdentifierNormalizer.canonicalize(second))
                .isEqualTo("message_id#m-1##queue#orders");
    }

    @Test
    void valuesAreStringified() {
        var attributes = new HashMap<String, Object>();
        attributes.put("size", 42);
        attributes.put("etag", null);

        assertThat(IdentifierNormalizer.canonicalize(attributes)).isEqualTo("etag###size#42");
    }

    @Test
    void emptyOrMissingAttributesGiveEmptyIdentifier() {
        assertThat(IdentifierNormalizer.canonicalize(null)).isEmpty();
        assertThat(IdentifierNormalizer.canonicalize(Map.of())).isEmpty();
    }

    @Test
    void keysSortByCodePoint() {
        assertThat(IdentifierNormalizer.canonicalize(Map.of("b", "1", "B", "2", "a", "3")))
                .isEqualTo("B#2##a#3##b#1");
    }
}
