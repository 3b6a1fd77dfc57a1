package de.bsommerfeld.opencode.usage.reader;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A part file found by the {@link StorageScanner} together with its
 * modification time, which drives both period filtering and the reader's
 * parse memo.
 */
public record ScannedFile(Path path, Instant lastModified) {
}
