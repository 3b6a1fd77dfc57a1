/**
 * SQLite persistence of daily usage snapshots.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   DataCollector / UsageService
 *        │
 *        ▼
 *   SnapshotRepository   ← typed queries, one method per SQL file
 *        │
 *        ▼
 *   DatabaseManager      ← single connection, lock-guarded lease, migrations
 * </pre>
 *
 * <h2>Schema</h2>
 *
 * <pre>
 * usage_snapshots
 *   id (PK, auto)        surrogate key, stable across upserts
 *   date (UQ)            YYYY-MM-DD, UTC
 *   input_tokens         all-time totals as of that day
 *   output_tokens
 *   reasoning_tokens
 *   cache_write_tokens
 *   cache_read_tokens
 *   total_cost           USD
 *   interaction_count
 *   created_at           RFC 3339 UTC, time of the last write
 *
 * schema_version
 *   version (PK)         applied migration
 *   applied_at           RFC 3339 UTC
 * </pre>
 *
 * <h2>SQL File Inventory</h2>
 * <ul>
 * <li>{@code migrations/001-initial-schema.sql}, {@code migrations/002-unique-date.sql}</li>
 * <li>{@code check-schema-version-table.sql}, {@code select-schema-version.sql},
 * {@code insert-schema-version.sql}</li>
 * <li>{@code upsert-snapshot.sql}, {@code select-snapshot.sql},
 * {@code select-snapshot-range.sql}, {@code select-latest-snapshot.sql},
 * {@code delete-old-snapshots.sql}, {@code count-snapshots.sql}</li>
 * </ul>
 */
package de.bsommerfeld.opencode.usage.db;
