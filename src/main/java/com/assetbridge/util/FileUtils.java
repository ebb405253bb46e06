package com.assetbridge.util;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;

/**
 * Utility class for file name handling.
 */
public class FileUtils {

    /**
     * Extracts the file extension from a file name.
     *
     * @param fileName The file name (e.g., "image.png").
     * @return The extension (lowercase, without dot), or an empty string if none found.
     */
    public static String getExtension(String fileName) {
        if (fileName == null) {
            return "";
        }
        int i = fileName.lastIndexOf('.');
        // ".gitignore" (i=0) has no extension
        if (i > 0) {
            return fileName.substring(i + 1).toLowerCase();
        }
        return "";
    }

    /**
     * @return the file name without its extension ("model_01.glb" -> "model_01").
     */
    public static String getStem(Path file) {
        Path fileName = file.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int i = name.lastIndexOf('.');
        return i > 0 ? name.substring(0, i) : name;
    }

    /**
     * Hidden files, macOS resource forks ("._x.png") and partial downloads are never assets.
     */
    public static boolean isIgnoredName(String fileName) {
        if (fileName == null || fileName.isEmpty()) {
            return true;
        }
        String lower = fileName.toLowerCase();
        return fileName.startsWith(".") || lower.endsWith(".part") || lower.endsWith(".tmp") || lower.endsWith(".filepart");
    }

    /**
     * Compiles glob patterns (e.g. "*.png") into case-insensitive file name matchers.
     */
    public static List<PathMatcher> compilePatterns(List<String> patterns) {
        List<PathMatcher> matchers = new ArrayList<>();
        for (String pattern : patterns) {
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern.toLowerCase()));
        }
        return matchers;
    }

    /**
     * Matches the file name only; an empty matcher list accepts everything.
     */
    public static boolean matchesAny(Path file, List<PathMatcher> matchers) {
        Path fileName = file.getFileName();
        if (fileName == null || isIgnoredName(fileName.toString())) {
            return false;
        }
        if (matchers.isEmpty()) {
            return true;
        }
        Path lowerName = Path.of(fileName.toString().toLowerCase());
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(lowerName)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Canonical string key used for every asset path in the engine.
     */
    public static String normalize(Path path) {
        return path.toAbsolutePath().normalize().toString();
    }
}
