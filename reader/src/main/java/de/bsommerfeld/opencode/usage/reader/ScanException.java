package de.bsommerfeld.opencode.usage.reader;

import java.nio.file.Path;

/**
 * Thrown when the storage root itself cannot be traversed. Problems with
 * individual entries below the root never surface as this exception.
 */
public class ScanException extends Exception {

    public enum Kind {
        /** The storage root does not exist. */
        NOT_FOUND,
        /** The storage root exists but is not a readable directory. */
        IO
    }

    private final Kind kind;
    private final Path root;

    public ScanException(Kind kind, Path root, String message) {
        super(message);
        this.kind = kind;
        this.root = root;
    }

    public ScanException(Kind kind, Path root, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.root = root;
    }

    public Kind getKind() {
        return kind;
    }

    public Path getRoot() {
        return root;
    }
}
