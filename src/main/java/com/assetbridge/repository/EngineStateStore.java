package com.assetbridge.repository;

import com.assetbridge.model.Association;
import com.assetbridge.util.ProjectLogger;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Manages the persisted engine state document (state.json).
 * The document is located inside the .AssetBridge folder of the state root and holds
 * image-to-model associations, textured markers and per-asset selection flags.
 * It is flat and always written as a whole; there are no partial updates.
 */
public class EngineStateStore {
    private static final String STATE_FILE = "state.json";
    private static final int CURRENT_VERSION = 1;

    private final Path stateRoot;
    private final Path stateFile;
    private final ObjectMapper mapper;

    public EngineStateStore(Path stateRoot) {
        this.stateRoot = stateRoot;
        this.stateFile = stateRoot.resolve(ProjectLogger.STATE_FOLDER).resolve(STATE_FILE);
        this.mapper = new ObjectMapper();
    }

    public Path getStateFile() {
        return stateFile;
    }

    /**
     * Reads the document. A missing file yields an empty snapshot; an unreadable one is logged
     * and also yields an empty snapshot so the engine can start fresh.
     */
    public Snapshot load() {
        Snapshot snapshot = new Snapshot();
        if (!Files.exists(stateFile)) {
            return snapshot;
        }

        JsonNode root;
        try {
            root = mapper.readTree(stateFile.toFile());
        } catch (IOException e) {
            ProjectLogger.logError(stateRoot, "EngineStateStore", "Failed to read state document, starting fresh", e);
            return snapshot;
        }
        if (root == null || !root.isObject()) {
            return snapshot;
        }

        JsonNode associations = root.path("associations");
        Iterator<Map.Entry<String, JsonNode>> it = associations.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String model = entry.getValue().path("model").asText("");
            if (model.isEmpty()) {
                continue;
            }
            Instant createdAt = parseInstant(entry.getValue().path("created_at").asText(null));
            snapshot.associations.put(entry.getKey(), new Association(entry.getKey(), model, createdAt));
        }

        root.path("textured").fields().forEachRemaining(entry ->
                snapshot.textured.put(entry.getKey(), entry.getValue().asText("")));

        root.path("selection").fields().forEachRemaining(entry ->
                snapshot.selection.put(entry.getKey(), entry.getValue().asBoolean(false)));

        ProjectLogger.logInfo(stateRoot, "EngineStateStore",
                "Loaded " + snapshot.associations.size() + " associations and " + snapshot.selection.size() + " selection flags");
        return snapshot;
    }

    /**
     * Writes the whole document, replacing the previous one.
     *
     * @throws StoreException if the document cannot be written
     */
    public void save(Snapshot snapshot) {
        ObjectNode root = mapper.createObjectNode();
        root.put("version", CURRENT_VERSION);

        ObjectNode associations = root.putObject("associations");
        for (Association association : snapshot.associations.values()) {
            ObjectNode node = associations.putObject(association.getImagePath());
            node.put("model", association.getModelPath());
            node.put("created_at", association.getCreatedAt().toString());
        }

        ObjectNode textured = root.putObject("textured");
        snapshot.textured.forEach((model, texturedPath) -> textured.put(model, texturedPath == null ? "" : texturedPath));

        ObjectNode selection = root.putObject("selection");
        snapshot.selection.forEach(selection::put);

        try {
            Files.createDirectories(stateFile.getParent());
            Path tmp = stateFile.resolveSibling(STATE_FILE + ".tmp");
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), root);
            try {
                Files.move(tmp, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, stateFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StoreException("Failed to write state document " + stateFile, e);
        }
    }

    private Instant parseInstant(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * In-memory image of the document. Maps keep insertion order so the file is stable between writes.
     */
    public static class Snapshot {
        private final Map<String, Association> associations = new LinkedHashMap<>();
        private final Map<String, String> textured = new LinkedHashMap<>();
        private final Map<String, Boolean> selection = new LinkedHashMap<>();

        public Snapshot() {
        }

        public Snapshot(Map<String, Association> associations, Map<String, String> textured, Map<String, Boolean> selection) {
            this.associations.putAll(associations);
            this.textured.putAll(textured);
            this.selection.putAll(selection);
        }

        /** Image path -> association. */
        public Map<String, Association> getAssociations() {
            return Collections.unmodifiableMap(associations);
        }

        /** Model path -> textured model path (empty when marked without a file). */
        public Map<String, String> getTextured() {
            return Collections.unmodifiableMap(textured);
        }

        public Map<String, Boolean> getSelection() {
            return Collections.unmodifiableMap(selection);
        }
    }
}
