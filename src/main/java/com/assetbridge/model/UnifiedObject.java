package com.assetbridge.model;

import java.util.Objects;

/**
 * One creative lineage (image, model, textured model) in the selection summary,
 * keyed by the most-derived asset known for that lineage.
 */
public class UnifiedObject {
    private final String key;
    private final String sourceImage;
    private final String model;
    private final String texturedModel;
    private final Progression progression;

    /**
     * Forward-only workflow state of a lineage.
     */
    public enum Progression {
        IMAGE_ONLY, HAS_MODEL, TEXTURED
    }

    public UnifiedObject(String key, String sourceImage, String model, String texturedModel, Progression progression) {
        this.key = Objects.requireNonNull(key, "Object key cannot be null");
        this.sourceImage = sourceImage;
        this.model = model;
        this.texturedModel = texturedModel;
        this.progression = Objects.requireNonNull(progression, "Progression cannot be null");
    }

    public String getKey() { return key; }
    public String getSourceImage() { return sourceImage; }
    public String getModel() { return model; }
    public String getTexturedModel() { return texturedModel; }
    public Progression getProgression() { return progression; }

    public boolean isStandalone() {
        return sourceImage == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UnifiedObject that = (UnifiedObject) o;
        return key.equals(that.key) &&
                Objects.equals(sourceImage, that.sourceImage) &&
                Objects.equals(model, that.model) &&
                Objects.equals(texturedModel, that.texturedModel) &&
                progression == that.progression;
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, sourceImage, model, texturedModel, progression);
    }

    @Override
    public String toString() {
        return "UnifiedObject{" +
                "key='" + key + '\'' +
                ", progression=" + progression +
                '}';
    }
}
