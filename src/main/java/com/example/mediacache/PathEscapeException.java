package com.example.mediacache;

/**
 * A relative path resolved outside of its trusted root.
 */
public class PathEscapeException extends MediaCacheException {
    public PathEscapeException(String message) {
        super(message);
    }

    public PathEscapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
