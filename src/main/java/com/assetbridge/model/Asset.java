package com.assetbridge.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * Represents a generated file (image, 3D model or textured model) known to the engine.
 * Assets are identified by their normalized absolute path and are never mutated once discovered.
 */
public class Asset {
    private final String path;
    private final AssetKind kind;
    private final Instant modifiedAt;

    public enum AssetKind {
        IMAGE, MODEL, TEXTURED_MODEL
    }

    public Asset(String path, AssetKind kind, Instant modifiedAt) {
        this.path = Objects.requireNonNull(path, "Asset path cannot be null");
        this.kind = Objects.requireNonNull(kind, "Asset kind cannot be null");
        this.modifiedAt = Objects.requireNonNull(modifiedAt, "Asset modification time cannot be null");
    }

    public String getPath() { return path; }
    public AssetKind getKind() { return kind; }
    public Instant getModifiedAt() { return modifiedAt; }

    public Path toPath() {
        return Path.of(path);
    }

    /**
     * @return the file name without its extension, e.g. "a" for "/out/a.png".
     */
    public String getStem() {
        Path fileName = toPath().getFileName();
        if (fileName == null) {
            return path;
        }
        String name = fileName.toString();
        int i = name.lastIndexOf('.');
        return i > 0 ? name.substring(0, i) : name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Asset asset = (Asset) o;
        return path.equals(asset.path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return "Asset{" +
                "path='" + path + '\'' +
                ", kind=" + kind +
                ", modifiedAt=" + modifiedAt +
                '}';
    }
}
