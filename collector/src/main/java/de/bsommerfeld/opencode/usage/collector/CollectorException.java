package de.bsommerfeld.opencode.usage.collector;

import de.bsommerfeld.opencode.usage.db.DatabaseException;

/**
 * Thrown when the daily snapshot could not be written.
 */
public class CollectorException extends Exception {

    public enum Kind {
        /** The repository failed; the cause is a {@link DatabaseException}. */
        DATABASE,
        /** The collection marker could not be locked in time. */
        LOCK
    }

    private final Kind kind;

    public CollectorException(DatabaseException cause) {
        super("Database error: " + cause.getMessage(), cause);
        this.kind = Kind.DATABASE;
    }

    public CollectorException(String message, Throwable cause) {
        super(message, cause);
        this.kind = Kind.LOCK;
    }

    public CollectorException(String message) {
        super(message);
        this.kind = Kind.LOCK;
    }

    public Kind getKind() {
        return kind;
    }
}
