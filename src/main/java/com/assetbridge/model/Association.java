package com.assetbridge.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A "generated-from" edge between a source image and the 3D model derived from it.
 */
public class Association {
    private final String imagePath;
    private final String modelPath;
    private final Instant createdAt;

    public Association(String imagePath, String modelPath, Instant createdAt) {
        this.imagePath = Objects.requireNonNull(imagePath, "Image path cannot be null");
        this.modelPath = Objects.requireNonNull(modelPath, "Model path cannot be null");
        this.createdAt = createdAt != null ? createdAt : Instant.now();
    }

    public String getImagePath() { return imagePath; }
    public String getModelPath() { return modelPath; }
    public Instant getCreatedAt() { return createdAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Association that = (Association) o;
        return imagePath.equals(that.imagePath) && modelPath.equals(that.modelPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(imagePath, modelPath);
    }

    @Override
    public String toString() {
        return "Association{" + imagePath + " -> " + modelPath + '}';
    }
}
