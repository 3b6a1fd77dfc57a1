package de.bsommerfeld.opencode.usage.db;

import java.util.List;

/**
 * The ordered migration history of the snapshot database. Append only: a
 * released migration is never edited, a schema change gets a new entry.
 */
public final class Migrations {

    private Migrations() {
    }

    public static List<Migration> all() {
        return List.of(
                new Migration(1, "initial schema",
                        SqlLoader.load("migrations/001-initial-schema")),
                new Migration(2, "one snapshot per date",
                        SqlLoader.load("migrations/002-unique-date")));
    }

    /** Highest version in {@link #all()}. */
    public static int latestVersion() {
        List<Migration> all = all();
        return all.get(all.size() - 1).version();
    }
}
