package com.assetbridge.util;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe logging utility that writes to the .AssetBridge folder of the engine state root.
 * Watcher threads, scan workers and the dispatcher loop all log through here, so writes are serialized.
 * Supports log rotation and aggregation of errors that repeat on every retry cycle.
 */
public class ProjectLogger {

    public static final String STATE_FOLDER = ".AssetBridge";

    private static final Object LOCK = new Object();
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String LOG_FILE_NAME = "engine.log";
    private static final String OLD_LOG_FILE_NAME = "engine.log.old";
    private static final long MAX_LOG_SIZE_BYTES = 5 * 1024 * 1024; // 5 MB

    private static final Set<Path> INITIALIZED_DIRS = ConcurrentHashMap.newKeySet();

    // StateRoot -> (ErrorSignature -> Count)
    private static final Map<Path, Map<String, AtomicInteger>> AGGREGATED_ERRORS = new ConcurrentHashMap<>();

    /**
     * Logs an error to the engine log under the given state root.
     *
     * @param stateRoot The state root (containing the .AssetBridge folder)
     * @param context   The class or service name (e.g., "DirectoryWatcher")
     * @param message   The error message
     * @param error     The exception (can be null)
     */
    public static void logError(Path stateRoot, String context, String message, Throwable error) {
        writeLog(stateRoot, "ERROR", context, message, error);
    }

    public static void logWarning(Path stateRoot, String context, String message) {
        writeLog(stateRoot, "WARN", context, message, null);
    }

    public static void logInfo(Path stateRoot, String context, String message) {
        writeLog(stateRoot, "INFO", context, message, null);
    }

    /**
     * Logs a recurring error. The first occurrence is written immediately,
     * identical ones (same context, message and exception type) are only counted
     * until {@link #flush(Path)} writes a summary.
     */
    public static void logRecurringError(Path stateRoot, String context, String message, Throwable error) {
        if (stateRoot == null) return;

        String signature = generateErrorSignature(context, message, error);
        Map<String, AtomicInteger> rootErrors = AGGREGATED_ERRORS.computeIfAbsent(stateRoot, k -> new ConcurrentHashMap<>());
        AtomicInteger counter = rootErrors.computeIfAbsent(signature, k -> new AtomicInteger(0));

        if (counter.getAndIncrement() == 0) {
            writeLog(stateRoot, "ERROR", context, message, error);
        }
    }

    /**
     * Writes how many additional times each aggregated error occurred since the last flush.
     */
    public static void flush(Path stateRoot) {
        if (stateRoot == null) return;

        Map<String, AtomicInteger> rootErrors = AGGREGATED_ERRORS.remove(stateRoot);
        if (rootErrors == null || rootErrors.isEmpty()) {
            return;
        }

        rootErrors.forEach((signature, count) -> {
            int total = count.get();
            if (total > 1) {
                writeLog(stateRoot, "SUMMARY", "ErrorAggregation",
                        String.format("The following error occurred %d additional times: %s", total - 1, signature), null);
            }
        });
    }

    public static Path getLogFile(Path stateRoot) {
        return stateRoot.resolve(STATE_FOLDER).resolve(LOG_FILE_NAME);
    }

    private static String generateErrorSignature(String context, String message, Throwable error) {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(context).append("] ").append(message);
        if (error != null) {
            sb.append(" | ").append(error.getClass().getName());
            if (error.getMessage() != null) {
                sb.append(": ").append(error.getMessage());
            }
        }
        return sb.toString();
    }

    private static void writeLog(Path stateRoot, String level, String context, String message, Throwable error) {
        if (stateRoot == null) return;

        StringBuilder sb = new StringBuilder();
        sb.append("[").append(LocalDateTime.now().format(DATE_FORMAT)).append("] ");
        sb.append("[").append(level).append("] ");
        sb.append("[").append(context).append("] ");
        sb.append(message);

        if (error != null) {
            sb.append(System.lineSeparator());
            StringWriter sw = new StringWriter();
            error.printStackTrace(new PrintWriter(sw));
            sb.append(sw);
        }
        sb.append(System.lineSeparator());

        synchronized (LOCK) {
            try {
                Path logDir = stateRoot.resolve(STATE_FOLDER);

                if (INITIALIZED_DIRS.add(logDir) || !Files.isDirectory(logDir)) {
                    Files.createDirectories(logDir);
                }

                Path logFile = logDir.resolve(LOG_FILE_NAME);

                if (Files.exists(logFile) && Files.size(logFile) > MAX_LOG_SIZE_BYTES) {
                    Path oldFile = logDir.resolve(OLD_LOG_FILE_NAME);
                    Files.move(logFile, oldFile, StandardCopyOption.REPLACE_EXISTING);
                }

                Files.writeString(
                    logFile,
                    sb.toString(),
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND,
                    StandardOpenOption.WRITE
                );

            } catch (IOException e) {
                // Fallback to console if file writing fails
                System.err.println("CRITICAL: Unable to write to engine log: " + e.getMessage());
                System.err.print(sb);
            }
        }
    }
}
