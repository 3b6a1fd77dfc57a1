package de.bsommerfeld.opencode.usage.db;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One schema step. The statements of {@code sql} run in order inside a
 * single transaction.
 */
public record Migration(int version, String description, String sql) {

    public Migration {
        if (version <= 0)
            throw new IllegalArgumentException("Migration version must be positive: " + version);
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(sql, "sql");
    }

    /**
     * Splits {@code sql} on semicolons at line ends. Blank fragments are
     * dropped.
     */
    public List<String> statements() {
        List<String> statements = new ArrayList<>();
        for (String statement : sql.split(";\\s*(\\r?\\n|$)")) {
            String trimmed = statement.trim();
            if (!trimmed.isEmpty())
                statements.add(trimmed);
        }
        return statements;
    }
}
