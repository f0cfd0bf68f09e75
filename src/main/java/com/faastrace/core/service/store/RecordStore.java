package com.faastrace.core.service.store;

import com.faastrace.core.service.model.Profile;
import com.faastrace.core.service.model.Trace;
import com.faastrace.core.service.model.TraceRecord;

import java.util.List;
import java.util.Optional;

/**
 * Interface for the durable record store.
 *
 * Holds the backlog of unprocessed records, the processed records, the reconstructed
 * traces and the profiles. Records are addressed by key; records uploaded through
 * {@link #putUnprocessed(TraceRecord)} use their record id as key. Keys and ids that do
 * not name a single entry of the store are refused with reason {@code INVALID_KEY}.
 */
public interface RecordStore {

    // ==================== Records ====================

    /**
     * Lists the keys of all unprocessed records.
     *
     * @return keys, oldest first, ties ordered by key
     * @throws RecordStoreException with reason {@code UNAVAILABLE} if the backlog cannot be listed
     */
    List<String> listUnprocessed();

    /**
     * Loads an unprocessed record.
     *
     * @param key the record key
     * @return the deserialized record, never shared with other callers
     * @throws RecordStoreException with reason {@code NOT_FOUND} or {@code DESERIALIZATION}
     */
    TraceRecord fetch(String key);

    /**
     * Moves a record out of the unprocessed backlog.
     *
     * @param key the record key
     * @throws RecordStoreException with reason {@code NOT_FOUND} if the record is not in the backlog
     */
    void markProcessed(String key);

    /**
     * Moves a record out of the backlog into quarantine, where it is kept for inspection
     * and never listed again.
     *
     * @param key the record key
     * @throws RecordStoreException with reason {@code NOT_FOUND} if the record is not in the backlog
     */
    void markFailed(String key);

    /**
     * Queues a record as unprocessed under its record id.
     *
     * @param record the record
     */
    void putUnprocessed(TraceRecord record);

    /**
     * Gets the number of unprocessed records.
     *
     * @return backlog size
     */
    default int countUnprocessed() {
        return listUnprocessed().size();
    }

    // ==================== Traces ====================

    void putTrace(Trace trace);

    Optional<Trace> getTrace(String traceId);

    List<String> listTraceIds();

    // ==================== Profiles ====================

    void putProfile(Profile profile);

    Optional<Profile> getProfile(String profileId);

    /**
     * Finds the profile of a root function.
     *
     * @param functionKey the canonical function identity key
     * @return the profile if one was stored for the function
     */
    Optional<Profile> findProfileByFunction(String functionKey);

    List<Profile> listProfiles();

    // ==================== Health ====================

    /**
     * Checks whether the store can currently be read and written.
     *
     * @return true if available
     */
    boolean isAvailable();
}
