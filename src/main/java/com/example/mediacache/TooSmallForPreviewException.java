package com.example.mediacache;

public class TooSmallForPreviewException extends MediaCacheException {
    public TooSmallForPreviewException(String message) {
        super(message);
    }

    public TooSmallForPreviewException(String message, Throwable cause) {
        super(message, cause);
    }
}
