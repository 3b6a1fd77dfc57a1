package de.bsommerfeld.opencode.usage.reader;

/**
 * Thrown by {@link UsageReader} when no metrics can be produced at all.
 */
public class ReaderException extends Exception {

    public enum Kind {
        /** The storage root is missing or unreadable; the cause is a {@link ScanException}. */
        SCAN,
        /** No part file in the requested window carried token data. */
        NO_DATA
    }

    private final Kind kind;

    public ReaderException(ScanException cause) {
        super("Scanner error: " + cause.getMessage(), cause);
        this.kind = Kind.SCAN;
    }

    public ReaderException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
