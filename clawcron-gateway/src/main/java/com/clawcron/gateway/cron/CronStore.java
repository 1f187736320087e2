package com.clawcron.gateway.cron;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * File-backed job collection.
 * <p>
 * Jobs are kept as an ordered id → job map, loaded lazily on first access and
 * rewritten in full on every save. The store remembers the modification time
 * and size of the file it last read or wrote, so callers can detect edits made
 * by another process and reload, including edits that land within the same
 * mtime tick.
 * <p>
 * Not thread-safe; callers serialize access.
 */
@Slf4j
public class CronStore {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.INDENT_OUTPUT, true);

    private final Path storePath;
    private Map<String, CronTypes.CronJob> jobs;
    private int version = CronTypes.CronStoreFile.CURRENT_VERSION;
    private Long lastMtimeMs;
    private Long lastSize;

    public CronStore(Path storePath) {
        this.storePath = storePath;
    }

    public Path getStorePath() {
        return storePath;
    }

    public boolean isLoaded() {
        return jobs != null;
    }

    /**
     * Live job map, loading from disk on first access.
     */
    public Map<String, CronTypes.CronJob> jobs() {
        if (jobs == null) {
            load();
        }
        return jobs;
    }

    public CronTypes.CronJob get(String id) {
        return jobs().get(id);
    }

    public void put(CronTypes.CronJob job) {
        jobs().put(job.getId(), job);
    }

    public CronTypes.CronJob remove(String id) {
        return jobs().remove(id);
    }

    /**
     * Read the backing file, replacing the in-memory collection.
     * A missing file yields an empty collection; an unreadable one is copied
     * aside and also yields an empty collection.
     */
    public Collection<CronTypes.CronJob> load() {
        Long mtime = getFileMtimeMs(storePath);
        Long size = getFileSize(storePath);
        CronTypes.CronStoreFile file = readFile(storePath);
        Map<String, CronTypes.CronJob> loaded = new LinkedHashMap<>();
        for (CronTypes.CronJob job : file.getJobs()) {
            loaded.put(job.getId(), job);
        }
        this.jobs = loaded;
        this.version = file.getVersion();
        this.lastMtimeMs = mtime;
        this.lastSize = size;
        return loaded.values();
    }

    /**
     * Whether the backing file differs in mtime or size from the last load or
     * save.
     */
    public boolean hasChangedOnDisk() {
        Long current = getFileMtimeMs(storePath);
        if (current == null) {
            return false;
        }
        return !current.equals(lastMtimeMs) || !Objects.equals(getFileSize(storePath), lastSize);
    }

    /**
     * Reload when {@link #hasChangedOnDisk()}; returns whether it did.
     */
    public boolean reloadIfChanged() {
        if (!isLoaded()) {
            load();
            return true;
        }
        if (!hasChangedOnDisk()) {
            return false;
        }
        log.info("cron: {} changed on disk, reloading", storePath.getFileName());
        load();
        return true;
    }

    /**
     * Write the whole collection to the backing file.
     */
    public void save() throws IOException {
        Path parent = storePath.getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }

        CronTypes.CronStoreFile file = CronTypes.CronStoreFile.builder()
                .version(version)
                .jobs(new ArrayList<>(jobs().values()))
                .build();

        String json = MAPPER.writeValueAsString(file);
        Files.writeString(storePath, json, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        lastMtimeMs = getFileMtimeMs(storePath);
        lastSize = getFileSize(storePath);
        log.debug("cron: saved {} ({} jobs)", storePath, file.getJobs().size());
    }

    // =========================================================================
    // File helpers
    // =========================================================================

    static CronTypes.CronStoreFile readFile(Path path) {
        if (!Files.exists(path)) {
            log.debug("cron: store file not found: {}", path);
            return new CronTypes.CronStoreFile();
        }

        try {
            String content = Files.readString(path);
            if (content.isBlank()) {
                return new CronTypes.CronStoreFile();
            }

            JsonNode root = MAPPER.readTree(content);
            JsonNode jobsNode = root.get("jobs");
            if (!root.isObject() || (jobsNode != null && !jobsNode.isArray())) {
                throw new IOException("unexpected document shape");
            }

            List<CronTypes.CronJob> jobs = new ArrayList<>();
            if (jobsNode != null) {
                for (JsonNode entry : jobsNode) {
                    CronTypes.CronJob job = convertJob(entry);
                    if (job != null) {
                        jobs.add(job);
                    }
                }
            }
            int version = root.path("version").asInt(CronTypes.CronStoreFile.CURRENT_VERSION);
            return CronTypes.CronStoreFile.builder().version(version).jobs(jobs).build();

        } catch (IOException e) {
            log.warn("cron: failed to load store {}: {}", path, e.getMessage());
            backupCorrupt(path);
            return new CronTypes.CronStoreFile();
        }
    }

    private static CronTypes.CronJob convertJob(JsonNode entry) {
        try {
            CronTypes.CronJob job = MAPPER.treeToValue(entry, CronTypes.CronJob.class);
            if (job == null || job.getId() == null || job.getId().isBlank()) {
                log.warn("cron: skipping job entry without id");
                return null;
            }
            if (job.getState() == null) {
                job.setState(new CronTypes.CronJobState());
            }
            if (job.getPayload() == null) {
                job.setPayload(new CronTypes.CronPayload());
            }
            if (job.getName() == null) {
                job.setName(job.getId());
            }
            return job;
        } catch (IOException | IllegalArgumentException e) {
            log.warn("cron: skipping malformed job entry: {}", e.getMessage());
            return null;
        }
    }

    private static void backupCorrupt(Path path) {
        Path backup = path.resolveSibling(path.getFileName() + ".corrupt-" + System.currentTimeMillis());
        try {
            Files.copy(path, backup, StandardCopyOption.REPLACE_EXISTING);
            log.warn("cron: copied unreadable store to {}", backup);
        } catch (IOException e) {
            log.warn("cron: could not back up unreadable store {}: {}", path, e.getMessage());
        }
    }

    /**
     * Get the file modification time in millis, or null if it does not exist.
     */
    public static Long getFileMtimeMs(Path path) {
        try {
            if (!Files.exists(path))
                return null;
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            return null;
        }
    }

    /**
     * Get the file size in bytes, or null if it does not exist.
     */
    static Long getFileSize(Path path) {
        try {
            if (!Files.exists(path))
                return null;
            return Files.size(path);
        } catch (IOException e) {
            return null;
        }
    }
}
