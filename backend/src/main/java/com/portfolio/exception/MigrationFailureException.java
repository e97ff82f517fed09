package com.portfolio.exception;

/**
 * Exception thrown when a startup data migration fails.
 *
 * The migration's transaction has been rolled back and no marker was written,
 * so the migration runs again on the next start. Propagates out of context
 * refresh and stops the application.
 *
 * @see com.portfolio.migration.MigrationRunner
 */
public class MigrationFailureException extends RuntimeException {

    private final String migrationKey;

    public MigrationFailureException(String migrationKey, String message, Throwable cause) {
        super(message, cause);
        this.migrationKey = migrationKey;
    }

    public String getMigrationKey() {
        return migrationKey;
    }

    /**
     * Wraps the failure of one migration.
     *
     * @param migrationKey key of the failed migration
     * @param cause the error raised by the migration
     * @return a MigrationFailureException with a formatted message
     */
    public static MigrationFailureException forMigration(String migrationKey, Throwable cause) {
        return new MigrationFailureException(
                migrationKey,
                String.format("Data migration '%s' failed and was rolled back; it will be retried on next start.", migrationKey),
                cause
        );
    }
}
