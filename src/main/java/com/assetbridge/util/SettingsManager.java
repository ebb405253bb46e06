package com.assetbridge.util;

import com.assetbridge.model.Asset.AssetKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Manages engine settings: watched output directories, per-kind file patterns and resource quotas.
 * Settings live in a settings.json document; every setter rewrites the whole document.
 * Uses Jackson for JSON serialization/deserialization.
 */
public class SettingsManager {

    private static final String APP_DIR = ".AssetBridgeGlobal";
    private static final String SETTINGS_FILE = "settings.json";

    private static final List<String> DEFAULT_IMAGE_PATTERNS = List.of("*.png", "*.jpg", "*.jpeg", "*.webp");
    private static final List<String> DEFAULT_MODEL_PATTERNS = List.of("*.glb", "*.gltf", "*.obj", "*.fbx");

    private static SettingsManager instance;
    private final File configDir;
    private final File settingsFile;
    private final ObjectMapper mapper;
    private JsonNode rootNode;

    public SettingsManager(Path configDir) {
        this.configDir = configDir.toFile();
        if (!this.configDir.exists()) {
            this.configDir.mkdirs();
        }
        settingsFile = new File(this.configDir, SETTINGS_FILE);
        mapper = new ObjectMapper();
        loadSettings();
    }

    public static synchronized SettingsManager getInstance() {
        if (instance == null) {
            String userHome = System.getProperty("user.home");
            instance = new SettingsManager(Path.of(userHome, APP_DIR));
        }
        return instance;
    }

    private void loadSettings() {
        if (settingsFile.exists()) {
            try {
                rootNode = mapper.readTree(settingsFile);
                if (rootNode == null || !rootNode.isObject()) {
                    rootNode = mapper.createObjectNode();
                }
            } catch (IOException e) {
                System.err.println("Failed to read settings, using defaults: " + e.getMessage());
                rootNode = mapper.createObjectNode();
            }
        } else {
            rootNode = mapper.createObjectNode();
        }
    }

    private void saveSettings() {
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(settingsFile, rootNode);
        } catch (IOException e) {
            System.err.println("Failed to save settings: " + e.getMessage());
        }
    }

    public Path getConfigDir() {
        return configDir.toPath();
    }

    // --- Directories ---

    public Path getImagesDir() {
        return getPath("images_dir", getConfigDir().resolve("images"));
    }

    public void setImagesDir(Path dir) {
        setPath("images_dir", dir);
    }

    public Path getModelsDir() {
        return getPath("models_dir", getConfigDir().resolve("3d_models"));
    }

    public void setModelsDir(Path dir) {
        setPath("models_dir", dir);
    }

    public Path getTexturedModelsDir() {
        return getPath("textured_models_dir", getModelsDir().resolve("textured"));
    }

    public void setTexturedModelsDir(Path dir) {
        setPath("textured_models_dir", dir);
    }

    public Path getStateDir() {
        return getPath("state_dir", getConfigDir());
    }

    public void setStateDir(Path dir) {
        setPath("state_dir", dir);
    }

    public Path getDirectoryFor(AssetKind kind) {
        switch (kind) {
            case IMAGE:
                return getImagesDir();
            case MODEL:
                return getModelsDir();
            case TEXTURED_MODEL:
                return getTexturedModelsDir();
            default:
                throw new IllegalArgumentException("Unknown asset kind: " + kind);
        }
    }

    // --- Per-kind patterns ---

    public List<String> getPatterns(AssetKind kind) {
        List<String> patterns = new ArrayList<>();
        JsonNode node = rootNode.path("patterns").path(patternKey(kind));
        if (node.isArray()) {
            for (JsonNode pattern : node) {
                patterns.add(pattern.asText());
            }
        }
        if (patterns.isEmpty()) {
            patterns.addAll(kind == AssetKind.IMAGE ? DEFAULT_IMAGE_PATTERNS : DEFAULT_MODEL_PATTERNS);
        }
        return patterns;
    }

    public void setPatterns(AssetKind kind, List<String> patterns) {
        ObjectNode patternsNode;
        if (rootNode.has("patterns") && rootNode.get("patterns").isObject()) {
            patternsNode = (ObjectNode) rootNode.get("patterns");
        } else {
            patternsNode = ((ObjectNode) rootNode).putObject("patterns");
        }
        ArrayNode array = mapper.createArrayNode();
        patterns.forEach(array::add);
        patternsNode.set(patternKey(kind), array);
        saveSettings();
    }

    private String patternKey(AssetKind kind) {
        return kind.name().toLowerCase();
    }

    // --- Quotas and timings ---

    public int getPreviewTotalQuota() {
        return getInt("preview_total_quota", 15);
    }

    public void setPreviewTotalQuota(int quota) {
        setInt("preview_total_quota", quota);
    }

    public int getPreviewSessionQuota() {
        return getInt("preview_session_quota", 10);
    }

    public void setPreviewSessionQuota(int quota) {
        setInt("preview_session_quota", quota);
    }

    public int getDispatcherCapacity() {
        return getInt("dispatcher_capacity", 1024);
    }

    public void setDispatcherCapacity(int capacity) {
        setInt("dispatcher_capacity", capacity);
    }

    public Duration getAutoLinkWindow() {
        return Duration.ofSeconds(getInt("auto_link_window_seconds", 600));
    }

    public void setAutoLinkWindow(Duration window) {
        setInt("auto_link_window_seconds", (int) window.getSeconds());
    }

    public Duration getWatcherPollInterval() {
        return Duration.ofMillis(getInt("watcher_poll_millis", 500));
    }

    public void setWatcherPollInterval(Duration interval) {
        setInt("watcher_poll_millis", (int) interval.toMillis());
    }

    public Duration getWatcherMaxBackoff() {
        return Duration.ofMillis(getInt("watcher_max_backoff_millis", 30_000));
    }

    public void setWatcherMaxBackoff(Duration backoff) {
        setInt("watcher_max_backoff_millis", (int) backoff.toMillis());
    }

    public Duration getPreviewIdleTimeout() {
        return Duration.ofSeconds(getInt("preview_idle_timeout_seconds", 300));
    }

    public void setPreviewIdleTimeout(Duration timeout) {
        setInt("preview_idle_timeout_seconds", (int) timeout.getSeconds());
    }

    private Path getPath(String key, Path defaultValue) {
        if (rootNode.has(key) && !rootNode.get(key).asText().isEmpty()) {
            return Path.of(rootNode.get(key).asText());
        }
        return defaultValue;
    }

    private void setPath(String key, Path value) {
        ((ObjectNode) rootNode).put(key, value.toAbsolutePath().toString());
        saveSettings();
    }

    private int getInt(String key, int defaultValue) {
        if (rootNode.has(key) && rootNode.get(key).canConvertToInt()) {
            return rootNode.get(key).asInt();
        }
        return defaultValue;
    }

    private void setInt(String key, int value) {
        ((ObjectNode) rootNode).put(key, value);
        saveSettings();
    }
}
