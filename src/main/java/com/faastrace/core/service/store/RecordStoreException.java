package com.faastrace.core.service.store;

/**
 * Exception thrown when the record store cannot serve or accept an entity.
 */
public class RecordStoreException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        INVALID_KEY,
        DESERIALIZATION,
        UNAVAILABLE,
        WRITE_FAILED
    }

    private final String key;
    private final Reason reason;

    public RecordStoreException(String message, String key, Reason reason) {
        super(message);
        this.key = key;
        this.reason = reason;
    }

    public RecordStoreException(String message, String key, Reason reason, Throwable cause) {
        super(message, cause);
        this.key = key;
        this.reason = reason;
    }

    public static RecordStoreException notFound(String kind, String key) {
        return new RecordStoreException("%s not found: %s".formatted(kind, key), key, Reason.NOT_FOUND);
    }

    public static RecordStoreException invalidKey(String kind, String key) {
        return new RecordStoreException("%s key does not name an entry of the store: %s".formatted(kind, key),
                key, Reason.INVALID_KEY);
    }

    public String getKey() {
        return key;
    }

    public Reason getReason() {
        return reason;
    }
}
