package com.example.mediacache;

/**
 * The source media is corrupt or in a format no installed reader understands.
 */
public class DecodeException extends MediaCacheException {
    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isMemoizable() {
        return true;
    }
}
