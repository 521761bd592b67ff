package com.example.mediacache;

/**
 * The external video frame extractor failed, timed out or produced no output.
 */
public class ExternalToolException extends MediaCacheException {
    public ExternalToolException(String message) {
        super(message);
    }

    public ExternalToolException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isMemoizable() {
        return true;
    }
}
