package com.assetbridge.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ProjectLoggerTest {

    @TempDir
    Path tempDir;

    @Test
    void testLogInfo_ShouldWriteFormattedLine() throws IOException {
        ProjectLogger.logInfo(tempDir, "AssetEngine", "Engine started");

        String content = Files.readString(ProjectLogger.getLogFile(tempDir));
        assertTrue(content.contains("[INFO] [AssetEngine] Engine started"));
    }

    @Test
    void testLogError_ShouldIncludeStackTrace() throws IOException {
        ProjectLogger.logError(tempDir, "EngineStateStore", "Write failed", new IOException("disk full"));

        String content = Files.readString(ProjectLogger.getLogFile(tempDir));
        assertTrue(content.contains("[ERROR] [EngineStateStore] Write failed"));
        assertTrue(content.contains("java.io.IOException: disk full"));
    }

    /**
     * Repeated errors are written once and summarized on flush.
     */
    @Test
    void testLogRecurringError_ShouldAggregateUntilFlush() throws IOException {
        for (int i = 0; i < 4; i++) {
            ProjectLogger.logRecurringError(tempDir, "DirectoryWatcher", "Failed to watch images", null);
        }
        ProjectLogger.flush(tempDir);

        String content = Files.readString(ProjectLogger.getLogFile(tempDir));
        assertEquals(1, countOccurrences(content, "[ERROR] [DirectoryWatcher] Failed to watch images"));
        assertTrue(content.contains("occurred 3 additional times"));
    }

    private static int countOccurrences(String text, String needle) {
        int count = 0;
        int index = text.indexOf(needle);
        while (index >= 0) {
            count++;
            index = text.indexOf(needle, index + needle.length());
        }
        return count;
    }
}
