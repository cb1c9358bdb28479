package com.example.persession.services;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A session snapshot could not be written. The previous cache file, if any, is
 * left in place and will be reused by the next run.
 */
public class SessionCacheException extends RuntimeException {
    private final Path cacheFilePath;

    public SessionCacheException(Path cacheFilePath, IOException cause) {
        super("Failed to write session cache to " + cacheFilePath + ": " + cause.getMessage(), cause);
        this.cacheFilePath = cacheFilePath;
    }

    public Path getCacheFilePath() {
        return cacheFilePath;
    }

    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }
}
