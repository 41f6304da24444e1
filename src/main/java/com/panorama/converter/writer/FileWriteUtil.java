package com.panorama.converter.writer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * File output helpers that create missing parent directories.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content as UTF-8, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path parentDir = filePath.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
    }

    public static void createDirectories(Path dir) throws IOException {
        Files.createDirectories(dir);
    }

    /**
     * Turns a device group name into a file name stem: {@code /} and spaces become {@code _}.
     */
    public static String sanitizeFileName(String name) {
        return name.replace('/', '_').replace(' ', '_');
    }
}
