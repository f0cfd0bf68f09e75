package com.faastrace.core.service.model;

import java.util.Map;

/**
 * Named measurement result attached to a record (cpu, memory, network, ...).
 * The reconstruction core never looks inside.
 */
public record RecordData(
        String name,
        Map<String, Object> results
) {}
