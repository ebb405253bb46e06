package com.assetbridge.repository;

import com.assetbridge.model.Association;
import com.assetbridge.repository.EngineStateStore.Snapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EngineStateStoreTest {

    @TempDir
    Path tempDir;

    private EngineStateStore store;

    @BeforeEach
    void setUp() {
        store = new EngineStateStore(tempDir);
    }

    @Test
    void testLoad_MissingFile_ShouldReturnEmptySnapshot() {
        Snapshot snapshot = store.load();

        assertTrue(snapshot.getAssociations().isEmpty());
        assertTrue(snapshot.getTextured().isEmpty());
        assertTrue(snapshot.getSelection().isEmpty());
    }

    /**
     * A saved document is read back with associations, textured markers and selection flags.
     */
    @Test
    void testSaveThenLoad_ShouldRestoreDocument() {
        Instant created = Instant.parse("2024-05-01T12:00:00Z");
        Map<String, Association> associations = new LinkedHashMap<>();
        associations.put("/img/a.png", new Association("/img/a.png", "/mdl/a.glb", created));
        Map<String, String> textured = Map.of("/mdl/a.glb", "/mdl/textured/textured_a.glb");
        Map<String, Boolean> selection = new LinkedHashMap<>();
        selection.put("/img/a.png", true);
        selection.put("/mdl/a.glb", false);

        store.save(new Snapshot(associations, textured, selection));
        Snapshot loaded = new EngineStateStore(tempDir).load();

        Association association = loaded.getAssociations().get("/img/a.png");
        assertEquals("/mdl/a.glb", association.getModelPath());
        assertEquals(created, association.getCreatedAt());
        assertEquals("/mdl/textured/textured_a.glb", loaded.getTextured().get("/mdl/a.glb"));
        assertEquals(Boolean.TRUE, loaded.getSelection().get("/img/a.png"));
        assertEquals(Boolean.FALSE, loaded.getSelection().get("/mdl/a.glb"));
        assertFalse(Files.exists(store.getStateFile().resolveSibling("state.json.tmp")));
    }

    @Test
    void testSave_ShouldReplaceWholeDocument() {
        store.save(new Snapshot(Map.of(), Map.of(), Map.of("/img/a.png", true)));
        store.save(new Snapshot(Map.of(), Map.of(), Map.of("/img/b.png", true)));

        Snapshot loaded = store.load();

        assertEquals(1, loaded.getSelection().size());
        assertTrue(loaded.getSelection().containsKey("/img/b.png"));
    }

    @Test
    void testLoad_CorruptFile_ShouldStartFresh() throws Exception {
        Files.createDirectories(store.getStateFile().getParent());
        Files.writeString(store.getStateFile(), "{ not json");

        Snapshot snapshot = store.load();

        assertTrue(snapshot.getAssociations().isEmpty());
    }

    @Test
    void testSave_UnwritableLocation_ShouldThrowStoreException() throws Exception {
        // A regular file where the state folder should be makes the directory creation fail
        Path blocked = tempDir.resolve("blocked");
        Files.writeString(blocked, "file");
        EngineStateStore broken = new EngineStateStore(blocked);

        assertThrows(StoreException.class, () -> broken.save(new Snapshot()));
    }
}
