package com.assetbridge.service;

import java.util.Optional;

/**
 * Read-only view of image -> model -> textured model relationships used to build the unified selection.
 */
public interface Lineage {

    Optional<String> getModelForImage(String imagePath);

    Optional<String> getImageForModel(String modelPath);

    boolean isTextured(String modelPath);

    /**
     * @return the textured model file recorded for {@code modelPath}, if any
     */
    Optional<String> getTexturedModel(String modelPath);

    Optional<String> getModelForTextured(String texturedPath);

    Lineage NONE = new Lineage() {
        @Override
        public Optional<String> getModelForImage(String imagePath) {
            return Optional.empty();
        }

        @Override
        public Optional<String> getImageForModel(String modelPath) {
            return Optional.empty();
        }

        @Override
        public boolean isTextured(String modelPath) {
            return false;
        }

        @Override
        public Optional<String> getTexturedModel(String modelPath) {
            return Optional.empty();
        }

        @Override
        public Optional<String> getModelForTextured(String texturedPath) {
            return Optional.empty();
        }
    };
}
