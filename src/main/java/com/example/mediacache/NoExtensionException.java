package com.example.mediacache;

public class NoExtensionException extends MediaCacheException {
    public NoExtensionException(String message) {
        super(message);
    }

    public NoExtensionException(String message, Throwable cause) {
        super(message, cause);
    }
}
