package com.example.mediacache.cache;

import java.nio.file.Path;

/**
 * Outcome of a preview request. {@code tooSmall} means the source already fits the
 * configured maximum side and no preview was written; {@code path} is then null.
 */
public record PreviewResult(
        Path path,
        boolean tooSmall
) {
    public static PreviewResult of(Path path) {
        return new PreviewResult(path, false);
    }

    public static PreviewResult skippedTooSmall() {
        return new PreviewResult(null, true);
    }
}
