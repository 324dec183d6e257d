package com.reliabledownloader.utils;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Slf4j
public final class DestinationFiles {

    private DestinationFiles() {
    }

    /**
     * Best-effort delete used on failure paths; a failure is logged and never replaces the outcome being reported.
     */
    public static boolean deleteQuietly(Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to cleanup file: {}", file, e);
            return false;
        }
    }
}
