package com.fetchman.service.impl;

import com.fetchman.config.FetchmanProperties;
import com.fetchman.model.VariableRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class FileSecretStoreTest {

    @TempDir
    Path tempDir;

    private Path storeFile;

    @BeforeEach
    void setUp() {
        storeFile = tempDir.resolve("nested").resolve("variables.json");
    }

    private FileSecretStore newStore() {
        FetchmanProperties properties = new FetchmanProperties();
        properties.getStore().setPath(storeFile.toString());
        FileSecretStore store = new FileSecretStore(properties);
        store.init();
        return store;
    }

    @Test
    void load_shouldReturnEmptyListForUnknownWorkspace() {
        FileSecretStore store = newStore();

        assertThat(store.load("ws-unknown")).isEmpty();
        assertThat(storeFile).doesNotExist();
    }

    @Test
    void save_shouldPersistRecordsAcrossInstances() {
        List<VariableRecord> records = List.of(
                new VariableRecord("base_url", "aXY=:Y3Q=:dGFn", false),
                new VariableRecord("token", "aXY=:Y3Q=:dGFn", true));

        newStore().save("ws-1", records);

        assertThat(storeFile).exists();
        assertThat(newStore().load("ws-1")).containsExactlyElementsOf(records);
    }

    @Test
    void save_shouldReplaceRecordSetWholesale() {
        FileSecretStore store = newStore();
        store.save("ws-1", List.of(new VariableRecord("a", "x:y:z", false), new VariableRecord("b", "x:y:z", false)));

        List<VariableRecord> saved = store.save("ws-1", List.of(new VariableRecord("c", "x:y:z", true)));

        assertThat(saved).extracting(VariableRecord::key).containsExactly("c");
        assertThat(store.load("ws-1")).extracting(VariableRecord::key).containsExactly("c");
    }

    @Test
    void save_shouldKeepWorkspacesIsolated() {
        FileSecretStore store = newStore();
        store.save("ws-1", List.of(new VariableRecord("a", "x:y:z", false)));
        store.save("ws-2", List.of(new VariableRecord("b", "x:y:z", false)));

        assertThat(store.load("ws-1")).extracting(VariableRecord::key).containsExactly("a");
        assertThat(store.load("ws-2")).extracting(VariableRecord::key).containsExactly("b");
    }

    @Test
    void save_shouldWriteIsSecretFlagUnderItsWireName() throws IOException {
        newStore().save("ws-1", List.of(new VariableRecord("token", "x:y:z", true)));

        assertThat(Files.readString(storeFile)).contains("\"isSecret\" : true");
    }

    @Test
    void init_shouldBackUpCorruptedFileAndStartEmpty() throws IOException {
        Files.createDirectories(storeFile.getParent());
        Files.writeString(storeFile, "{ this is not json");

        FileSecretStore store = newStore();

        assertThat(store.load("ws-1")).isEmpty();
        assertThat(storeFile).doesNotExist();
        try (Stream<Path> files = Files.list(storeFile.getParent())) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .anyMatch(name -> name.startsWith("variables.json.corrupted."));
        }
    }

    @Test
    void isAvailable_shouldBeTrueForWritableLocation() {
        assertThat(newStore().isAvailable()).isTrue();
    }
}
