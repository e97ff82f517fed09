package com.portfolio.migration;

/**
 * A one-shot data transformation applied at startup.
 *
 * Implementations are Spring beans ordered with {@code @Order}. The runner
 * calls {@link #apply()} inside a transaction and records the key in
 * {@code migration_markers} when it commits; a migration whose key is recorded
 * is never applied again. {@code apply} must still be safe to repeat from
 * scratch, since a failed run leaves no marker.
 *
 * @see MigrationRunner
 */
public interface DataMigration {

    /**
     * @return unique, stable key of this migration, e.g. {@code people-backfill-v1}
     */
    String key();

    /**
     * Perform the transformation in the caller's transaction.
     */
    void apply();
}
