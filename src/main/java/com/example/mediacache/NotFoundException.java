package com.example.mediacache;

public class NotFoundException extends MediaCacheException {
    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
