package com.faastrace.core.service.correlation;

/**
 * Thrown when a canonical identifier is cached twice on the same side while the first
 * entry is still unresolved. Indicates a measurement bug or an identifier collision.
 */
public class DuplicateCorrelationException extends RuntimeException {

    private final String identifier;
    private final Side side;
    private final String recordId;

    public DuplicateCorrelationException(String identifier, Side side, String recordId) {
        super("Identifier duplicate for '%s' in %s requests (record %s)"
                .formatted(identifier, side.name().toLowerCase(), recordId));
        this.identifier = identifier;
        this.side = side;
        this.recordId = recordId;
    }

    public String getIdentifier() {
        return identifier;
    }

    public Side getSide() {
        return side;
    }

    public String getRecordId() {
        return recordId;
    }

    public enum Side {
        INBOUND,
        OUTBOUND
    }
}
