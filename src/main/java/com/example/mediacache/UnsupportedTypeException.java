package com.example.mediacache;

/**
 * The requested artifact cannot be produced for this kind of media.
 */
public class UnsupportedTypeException extends MediaCacheException {
    public UnsupportedTypeException(String message) {
        super(message);
    }

    public UnsupportedTypeException(String message, Throwable cause) {
        super(message, cause);
    }
}
