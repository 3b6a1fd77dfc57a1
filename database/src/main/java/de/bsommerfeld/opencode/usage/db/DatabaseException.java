package de.bsommerfeld.opencode.usage.db;

/**
 * Failure of the snapshot database. The {@link Kind} tells callers whether
 * the store is unusable ({@code IO}, {@code CONNECTION}, {@code MIGRATION})
 * or a single statement failed ({@code QUERY}).
 */
public class DatabaseException extends Exception {

    public enum Kind {
        /** Filesystem problem around the database file, e.g. parent directory not creatable. */
        IO,
        /** A migration failed and was rolled back. */
        MIGRATION,
        /** The driver could not open or configure the connection. */
        CONNECTION,
        /** A statement against an open database failed. */
        QUERY
    }

    private final Kind kind;

    public DatabaseException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DatabaseException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
