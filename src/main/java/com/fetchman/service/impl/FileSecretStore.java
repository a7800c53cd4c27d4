package com.fetchman.service.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fetchman.config.FetchmanProperties;
import com.fetchman.exception.FetchmanException;
import com.fetchman.model.VariableRecord;
import com.fetchman.service.api.SecretStore;
import jakarta.annotation.PostConstruct;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * A file-based implementation of the {@link SecretStore} that persists every workspace's encrypted
 * variable records to a single JSON document.
 * <p>
 * Records are held in memory and written through to disk on every save. The values are already
 * ciphertext envelopes when they arrive here, so neither the file nor the in-memory copy ever holds
 * plaintext. File I/O is synchronized to keep concurrent saves from interleaving.
 */
@Service
@Slf4j
public class FileSecretStore implements SecretStore {

    private final File storeFile;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private Map<String, List<VariableRecord>> workspaces = new ConcurrentHashMap<>();

    public FileSecretStore(FetchmanProperties properties) {
        this.storeFile = new File(properties.getStore().getPath());
    }

    /**
     * Loads the persisted records once the bean is constructed.
     */
    @PostConstruct
    public void init() {
        loadState();
    }

    /**
     * {@inheritDoc}
     * <p>
     * Served from memory; the returned list is immutable.
     */
    @Override
    public List<VariableRecord> load(String workspaceId) {
        return workspaces.getOrDefault(workspaceId, List.of());
    }

    /**
     * {@inheritDoc}
     * <p>
     * The new record set only becomes visible once it has been written to disk, so a failed write
     * leaves the previous state in place.
     */
    @Override
    public synchronized List<VariableRecord> save(String workspaceId, List<VariableRecord> records) {
        List<VariableRecord> snapshot = List.copyOf(records);
        Map<String, List<VariableRecord>> next = new HashMap<>(workspaces);
        next.put(workspaceId, snapshot);
        writeState(next);
        workspaces.put(workspaceId, snapshot);
        log.info("Saved {} variable(s) for workspace '{}'", snapshot.size(), workspaceId);
        return snapshot;
    }

    @Override
    public boolean isAvailable() {
        if (storeFile.exists()) {
            return storeFile.canRead() && storeFile.canWrite();
        }
        File dir = storeFile.getAbsoluteFile().getParentFile();
        while (dir != null && !dir.exists()) {
            dir = dir.getParentFile();
        }
        return dir != null && dir.canWrite();
    }

    /**
     * Writes the given state to the store file, creating parent directories as needed.
     *
     * @throws FetchmanException if the directory cannot be created or the file cannot be written.
     */
    private synchronized void writeState(Map<String, List<VariableRecord>> state) {
        try {
            File parentDir = storeFile.getAbsoluteFile().getParentFile();
            if (!parentDir.exists() && !parentDir.mkdirs()) {
                throw new IOException("Failed to create parent directories at: " + parentDir.getAbsolutePath());
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(storeFile, Map.of("workspaces", state));
        } catch (IOException e) {
            log.error("CRITICAL: Failed to save variable store to {}", storeFile.getAbsolutePath(), e);
            throw new FetchmanException("Failed to save workspace variables", e);
        }
    }

    /**
     * Loads the store file into memory. A missing file means an empty store. A file that cannot be
     * parsed is backed up and the store starts empty rather than refusing to start.
     */
    private synchronized void loadState() {
        if (storeFile.exists() && storeFile.length() > 0) {
            try {
                TypeReference<HashMap<String, Map<String, List<VariableRecord>>>> typeRef = new TypeReference<>() {};
                Map<String, Map<String, List<VariableRecord>>> state = objectMapper.readValue(storeFile, typeRef);
                Map<String, List<VariableRecord>> loaded = new ConcurrentHashMap<>();
                Map<String, List<VariableRecord>> stored = state.get("workspaces");
                if (stored != null) {
                    stored.forEach((id, records) -> loaded.put(id, records == null ? List.of() : List.copyOf(records)));
                }
                this.workspaces = loaded;
                log.info("Loaded variables for {} workspace(s) from {}", loaded.size(), storeFile.getAbsolutePath());
            } catch (Exception e) {
                log.warn("Could not load or parse variable store at {}. A backup will be created and the store will start empty. Error: {}",
                        storeFile.getAbsolutePath(), e.getMessage());
                backupCorruptedStoreFile();
                this.workspaces = new ConcurrentHashMap<>();
            }
        } else {
            log.info("No variable store found at {}, starting with an empty store.", storeFile.getAbsolutePath());
        }
    }

    /**
     * Moves an unparseable store file aside with a {@code .corrupted.<millis>} suffix so it can be
     * inspected manually and does not break the next startup.
     */
    private void backupCorruptedStoreFile() {
        File backupFile = new File(storeFile.getAbsolutePath() + ".corrupted." + System.currentTimeMillis());
        try {
            Files.move(storeFile.toPath(), backupFile.toPath(), StandardCopyOption.REPLACE_EXISTING);
            log.info("Backed up corrupted variable store to {}", backupFile.getAbsolutePath());
        } catch (IOException e) {
            log.error("CRITICAL: Failed to back up corrupted variable store from {} to {}",
                    storeFile.getAbsolutePath(), backupFile.getAbsolutePath(), e);
        }
    }
}
