package com.example.doccatalog;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * A single file or directory that could not be read. Skips are counted and logged,
 * they never abort a run.
 */
public record IoSkip(
        Path path,
        SkipReason reason,
        String message
) {
    public static IoSkip from(Path path, IOException ex) {
        SkipReason reason;
        if (ex instanceof AccessDeniedException) {
            reason = SkipReason.PERMISSION_DENIED;
        } else if (ex instanceof NoSuchFileException) {
            reason = SkipReason.NOT_FOUND;
        } else {
            reason = SkipReason.IO_ERROR;
        }
        return new IoSkip(path, reason, ex.getMessage());
    }
}
