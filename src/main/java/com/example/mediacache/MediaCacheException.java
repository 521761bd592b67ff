package com.example.mediacache;

/**
 * Base type for every failure raised while listing media or producing cache artifacts.
 */
public class MediaCacheException extends Exception {
    public MediaCacheException(String message) {
        super(message);
    }

    public MediaCacheException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns true if the failure is permanent for the source file and should be
     * recorded with an error marker so the work is never attempted again.
     */
    public boolean isMemoizable() {
        return false;
    }
}
