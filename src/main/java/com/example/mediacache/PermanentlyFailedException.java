package com.example.mediacache;

/**
 * An error marker exists for the artifact; generation is not attempted again.
 */
public class PermanentlyFailedException extends MediaCacheException {
    public PermanentlyFailedException(String message) {
        super(message);
    }

    public PermanentlyFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
