package com.example.mediacache;

public class NotASubpathException extends MediaCacheException {
    public NotASubpathException(String message) {
        super(message);
    }

    public NotASubpathException(String message, Throwable cause) {
        super(message, cause);
    }
}
