package de.bsommerfeld.opencode.usage.reader;

/**
 * Thrown when a part file cannot be turned into a usage record. The reader
 * treats this as "the file contributes nothing" and moves on.
 */
public class UsageParseException extends Exception {

    public enum Kind {
        /** Content is not valid JSON or does not have the shape of a part. */
        JSON,
        /** The file could not be read. */
        IO
    }

    private final Kind kind;

    public UsageParseException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public UsageParseException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
