package com.example.mediacache;

/**
 * The source file is still held by another process (typically a copy in progress).
 * Transient: callers retry later instead of recording a failure.
 */
public class FileLockedException extends MediaCacheException {
    public FileLockedException(String message) {
        super(message);
    }

    public FileLockedException(String message, Throwable cause) {
        super(message, cause);
    }
}
