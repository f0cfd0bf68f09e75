package com.faastrace.core.service.store;

import com.faastrace.core.service.config.StorageConfig;
import com.faastrace.core.service.model.Profile;
import com.faastrace.core.service.model.Trace;
import com.faastrace.core.service.model.TraceRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Record store keeping every entity as a JSON file below a base directory.
 *
 * Layout: {@code unprocessed_records/}, {@code records/}, {@code failed_records/},
 * {@code traces/} and {@code profiles/}, one {@code <id>.json} file per entity.
 * An id must resolve to a file directly inside its directory.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "faas.storage", name = "type", havingValue = "filesystem", matchIfMissing = true)
public class FileSystemRecordStore implements RecordStore {

    static final String UNPROCESSED_DIR = "unprocessed_records";
    static final String PROCESSED_DIR = "records";
    static final String TRACES_DIR = "traces";
    static final String PROFILES_DIR = "profiles";
    static final String FAILED_DIR = "failed_records";

    private static final String FILE_SUFFIX = ".json";

    private final Path baseDir;
    private final ObjectMapper objectMapper;

    // function key -> profile id, loaded from profiles/ on first lookup
    private final Map<String, String> profileIndex = new ConcurrentHashMap<>();
    private volatile boolean profileIndexLoaded = false;

    public FileSystemRecordStore(StorageConfig storageConfig, ObjectMapper objectMapper) {
        this.baseDir = Path.of(storageConfig.getFilesystem().getBaseDir());
        this.objectMapper = objectMapper;
    }

    // ==================== Lifecycle ====================

    @PostConstruct
    void init() {
        try {
            for (var dir : List.of(UNPROCESSED_DIR, PROCESSED_DIR, TRACES_DIR, PROFILES_DIR, FAILED_DIR)) {
                Files.createDirectories(baseDir.resolve(dir));
            }
            log.info("Filesystem record store initialized at {}", baseDir.toAbsolutePath());
        } catch (IOException e) {
            log.error("Failed to create record store directories below {}", baseDir.toAbsolutePath(), e);
        }
    }

    // ==================== Records ====================

    @Override
    public List<String> listUnprocessed() {
        var dir = baseDir.resolve(UNPROCESSED_DIR);
        if (!Files.isDirectory(dir)) {
            throw new RecordStoreException("Unprocessed records directory missing: " + dir,
                    UNPROCESSED_DIR, RecordStoreException.Reason.UNAVAILABLE);
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(this::isJsonFile)
                    .map(this::toListedFile)
                    .sorted(Comparator.comparing(ListedFile::modifiedAt).thenComparing(ListedFile::key))
                    .map(ListedFile::key)
                    .toList();
        } catch (IOException e) {
            throw new RecordStoreException("Failed to list unprocessed records", UNPROCESSED_DIR,
                    RecordStoreException.Reason.UNAVAILABLE, e);
        }
    }

    @Override
    public TraceRecord fetch(String key) {
        var file = entityFile(UNPROCESSED_DIR, key);
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            throw RecordStoreException.notFound("Record", key);
        } catch (IOException e) {
            throw new RecordStoreException("Failed to read record " + key, key,
                    RecordStoreException.Reason.UNAVAILABLE, e);
        }
        try {
            return objectMapper.readValue(content, TraceRecord.class);
        } catch (IOException e) {
            throw new RecordStoreException("Failed to deserialize record " + key, key,
                    RecordStoreException.Reason.DESERIALIZATION, e);
        }
    }

    @Override
    public void markProcessed(String key) {
        moveOutOfBacklog(key, PROCESSED_DIR);
        log.debug("Marked record {} as processed", key);
    }

    @Override
    public void markFailed(String key) {
        moveOutOfBacklog(key, FAILED_DIR);
        log.debug("Moved record {} to {}", key, FAILED_DIR);
    }

    @Override
    public void putUnprocessed(TraceRecord record) {
        write(UNPROCESSED_DIR, record.getRecordId(), record);
    }

    // ==================== Traces ====================

    @Override
    public void putTrace(Trace trace) {
        write(TRACES_DIR, trace.getTraceId(), trace);
    }

    @Override
    public Optional<Trace> getTrace(String traceId) {
        return read(TRACES_DIR, traceId, Trace.class);
    }

    @Override
    public List<String> listTraceIds() {
        return listIds(TRACES_DIR);
    }

    // ==================== Profiles ====================

    @Override
    public void putProfile(Profile profile) {
        write(PROFILES_DIR, profile.getProfileId(), profile);
        if (profile.functionKey() != null) {
            profileIndex.put(profile.functionKey(), profile.getProfileId());
        }
    }

    @Override
    public Optional<Profile> getProfile(String profileId) {
        return read(PROFILES_DIR, profileId, Profile.class);
    }

    @Override
    public Optional<Profile> findProfileByFunction(String functionKey) {
        ensureProfileIndexLoaded();
        var profileId = profileIndex.get(functionKey);
        return profileId == null ? Optional.empty() : getProfile(profileId);
    }

    @Override
    public List<Profile> listProfiles() {
        var profiles = new ArrayList<Profile>();
        for (var profileId : listIds(PROFILES_DIR)) {
            getProfile(profileId).ifPresent(profiles::add);
        }
        return profiles;
    }

    // ==================== Health ====================

    @Override
    public boolean isAvailable() {
        return Files.isDirectory(baseDir.resolve(UNPROCESSED_DIR)) && Files.isWritable(baseDir);
    }

    // ==================== Private Methods ====================

    private synchronized void ensureProfileIndexLoaded() {
        if (profileIndexLoaded) return;
        for (var profile : listProfiles()) {
            if (profile.functionKey() != null) {
                profileIndex.putIfAbsent(profile.functionKey(), profile.getProfileId());
            }
        }
        profileIndexLoaded = true;
        log.debug("Loaded profile index with {} functions", profileIndex.size());
    }

    private Path entityFile(String dir, String id) {
        if (id == null || id.isBlank()) {
            throw RecordStoreException.invalidKey(dir, id);
        }
        var parent = baseDir.resolve(dir).normalize();
        var file = parent.resolve(id + FILE_SUFFIX).normalize();
        if (!parent.equals(file.getParent())) {
            throw RecordStoreException.invalidKey(dir, id);
        }
        return file;
    }

    private void moveOutOfBacklog(String key, String targetDir) {
        var source = entityFile(UNPROCESSED_DIR, key);
        var target = entityFile(targetDir, key);
        try {
            Files.createDirectories(target.getParent());
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (NoSuchFileException e) {
            throw RecordStoreException.notFound("Unprocessed record", key);
        } catch (IOException e) {
            throw new RecordStoreException("Failed to move record " + key + " to " + targetDir, key,
                    RecordStoreException.Reason.WRITE_FAILED, e);
        }
    }

    private boolean isJsonFile(Path file) {
        return Files.isRegularFile(file) && file.getFileName().toString().endsWith(FILE_SUFFIX);
    }

    private String stripSuffix(Path file) {
        var name = file.getFileName().toString();
        return name.substring(0, name.length() - FILE_SUFFIX.length());
    }

    private ListedFile toListedFile(Path file) {
        try {
            return new ListedFile(stripSuffix(file), Files.getLastModifiedTime(file));
        } catch (IOException e) {
            throw new RecordStoreException("Failed to stat " + file, stripSuffix(file),
                    RecordStoreException.Reason.UNAVAILABLE, e);
        }
    }

    private List<String> listIds(String dir) {
        var path = baseDir.resolve(dir);
        if (!Files.isDirectory(path)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(path)) {
            return files.filter(this::isJsonFile).map(this::stripSuffix).sorted().toList();
        } catch (IOException e) {
            throw new RecordStoreException("Failed to list " + dir, dir,
                    RecordStoreException.Reason.UNAVAILABLE, e);
        }
    }

    private <T> Optional<T> read(String dir, String id, Class<T> type) {
        var file = entityFile(dir, id);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), type));
        } catch (JsonProcessingException e) {
            throw new RecordStoreException("Failed to deserialize " + file, id,
                    RecordStoreException.Reason.DESERIALIZATION, e);
        } catch (IOException e) {
            throw new RecordStoreException("Failed to read " + file, id,
                    RecordStoreException.Reason.UNAVAILABLE, e);
        }
    }

    private void write(String dir, String id, Object entity) {
        var target = entityFile(dir, id);
        var temp = target.resolveSibling(id + FILE_SUFFIX + ".tmp");
        try {
            Files.createDirectories(target.getParent());
            objectMapper.writeValue(temp.toFile(), entity);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new RecordStoreException("Failed to write " + target, id,
                    RecordStoreException.Reason.WRITE_FAILED, e);
        }
    }

    private record ListedFile(String key, FileTime modifiedAt) {
    }
}
